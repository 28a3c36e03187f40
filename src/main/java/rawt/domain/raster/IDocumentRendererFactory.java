package rawt.domain.raster;

import java.nio.file.Path;

/**
 * Opens a document for page-by-page rendering
 * @since 19/10/2026
 */
public interface IDocumentRendererFactory {
    IPageRenderer open(Path document, String mimeType) throws RenderException;
}
