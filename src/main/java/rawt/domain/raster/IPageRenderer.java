package rawt.domain.raster;

/**
 * Renders the pages of one opened document.
 * Pages come back on a white background, scaled to the requested width with aspect ratio preserved.
 * @since 19/10/2026
 */
public interface IPageRenderer extends AutoCloseable {
    int getPageCount();

    PixelBuffer renderPage(int pageIndex, int targetWidth) throws RenderException;

    @Override
    void close();
}
