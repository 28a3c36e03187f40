package rawt.domain.raster;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Single page renderer for bitmap images (PNG, JPEG, BMP, GIF)
 * @since 19/10/2026
 */
public class ImagePageRenderer implements IPageRenderer {
    private final BufferedImage image;

    public ImagePageRenderer(BufferedImage image) {
        this.image = image;
    }

    public static ImagePageRenderer open(Path imageFile) throws RenderException {
        try {
            return new ImagePageRenderer(GraphUtils.loadImage(imageFile));
        } catch (IOException e) {
            throw new RenderException("Cannot open image: " + e.getMessage(), -1, e);
        }
    }

    @Override
    public int getPageCount() {
        return 1;
    }

    @Override
    public PixelBuffer renderPage(int pageIndex, int targetWidth) throws RenderException {
        if (pageIndex != 0) {
            throw new RenderException("Image documents have a single page", pageIndex);
        }
        BufferedImage flat = GraphUtils.flattenOntoWhite(image);
        return PixelBuffer.fromImage(GraphUtils.resizeToWidth(flat, targetWidth));
    }

    @Override
    public void close() {
        image.flush();
    }
}
