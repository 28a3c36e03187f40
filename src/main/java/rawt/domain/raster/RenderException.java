package rawt.domain.raster;

/**
 * Thrown when a document page cannot be rendered to pixels
 * @since 19/10/2026
 */
public class RenderException extends Exception {
    private final int pageIndex;

    public RenderException(String message, int pageIndex) {
        super(message);
        this.pageIndex = pageIndex;
    }

    public RenderException(String message, int pageIndex, Throwable cause) {
        super(message, cause);
        this.pageIndex = pageIndex;
    }

    /**
     * Page being rendered when the failure happened, -1 when opening the document
     */
    public int getPageIndex() {
        return pageIndex;
    }
}
