package rawt.domain.raster;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * PDFBox based page renderer. The document stays open until {@link #close()}.
 * @since 19/10/2026
 */
public class PdfPageRenderer implements IPageRenderer {
    private static final Logger logger = LoggerFactory.getLogger(PdfPageRenderer.class);

    private final PDDocument document;
    private final PDFRenderer renderer;

    private PdfPageRenderer(PDDocument document) {
        this.document = document;
        this.renderer = new PDFRenderer(document);
    }

    public static PdfPageRenderer open(Path pdfFile) throws RenderException {
        try {
            PDDocument document = PDDocument.load(pdfFile.toFile());
            logger.debug("Opened PDF {} ({} pages)", pdfFile.getFileName(), document.getNumberOfPages());
            return new PdfPageRenderer(document);
        } catch (IOException e) {
            throw new RenderException("Cannot open PDF document: " + e.getMessage(), -1, e);
        }
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public PixelBuffer renderPage(int pageIndex, int targetWidth) throws RenderException {
        if (pageIndex < 0 || pageIndex >= getPageCount()) {
            throw new RenderException("Page index out of range: " + pageIndex, pageIndex);
        }
        try {
            PDPage page = document.getPage(pageIndex);
            float pageWidth = page.getCropBox().getWidth();
            float scale = targetWidth / pageWidth;
            BufferedImage image = renderer.renderImage(pageIndex, scale, ImageType.RGB);
            if (image.getWidth() != targetWidth) {
                image = GraphUtils.resizeToWidth(image, targetWidth);
            }
            return PixelBuffer.fromImage(image);
        } catch (IOException e) {
            throw new RenderException("Failed to render page " + pageIndex + ": " + e.getMessage(), pageIndex, e);
        }
    }

    @Override
    public void close() {
        try {
            document.close();
        } catch (IOException e) {
            logger.warn("Error closing PDF document: {}", e.getMessage());
        }
    }
}
