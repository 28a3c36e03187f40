package rawt.domain.raster;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks a renderer from the MIME type, falling back to the file extension
 * @since 19/10/2026
 */
public class DocumentRendererFactory implements IDocumentRendererFactory {

    @Override
    public IPageRenderer open(Path document, String mimeType) throws RenderException {
        if (isPdf(document, mimeType)) {
            return PdfPageRenderer.open(document);
        }
        if (isImage(document, mimeType)) {
            return ImagePageRenderer.open(document);
        }
        throw new RenderException("Unsupported document type: " + mimeType, -1);
    }

    private static boolean isPdf(Path document, String mimeType) {
        if (mimeType != null && !mimeType.isBlank()) {
            return mimeType.toLowerCase(Locale.ROOT).startsWith("application/pdf");
        }
        return document.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static boolean isImage(Path document, String mimeType) {
        if (mimeType != null && !mimeType.isBlank()) {
            return mimeType.toLowerCase(Locale.ROOT).startsWith("image/");
        }
        String name = document.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".png") || name.endsWith(".jpg") || name.endsWith(".jpeg")
                || name.endsWith(".bmp") || name.endsWith(".gif");
    }
}
