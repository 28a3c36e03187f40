package rawt.domain.raster;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Image helpers used before quantization
 * @since 19/10/2026
 */
public final class GraphUtils {
    private static final Logger logger = LoggerFactory.getLogger(GraphUtils.class);

    private GraphUtils() {
        throw new AssertionError("Utility class cannot be instantiated.");
    }

    /**
     * Load an image file
     */
    public static BufferedImage loadImage(Path imagePath) throws IOException {
        BufferedImage image = ImageIO.read(imagePath.toFile());
        if (image == null) {
            throw new IOException("Unsupported or unreadable image: " + imagePath);
        }
        return image;
    }

    /**
     * Draw the image onto an opaque white background so transparent areas print as paper
     */
    public static BufferedImage flattenOntoWhite(BufferedImage source) {
        BufferedImage flat = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = flat.createGraphics();
        g2d.setColor(Color.WHITE);
        g2d.fillRect(0, 0, flat.getWidth(), flat.getHeight());
        g2d.drawImage(source, 0, 0, null);
        g2d.dispose();
        return flat;
    }

    /**
     * Resize image to the given width while maintaining aspect ratio, on a white background
     */
    public static BufferedImage resizeToWidth(BufferedImage originalImage, int targetWidth) {
        if (targetWidth <= 0) {
            throw new IllegalArgumentException("Target width must be positive: " + targetWidth);
        }
        double scale = (double) targetWidth / originalImage.getWidth();
        int newHeight = Math.max(1, (int) Math.round(originalImage.getHeight() * scale));

        BufferedImage resizedImage = new BufferedImage(targetWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = resizedImage.createGraphics();

        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

        g2d.setColor(Color.WHITE);
        g2d.fillRect(0, 0, targetWidth, newHeight);
        g2d.drawImage(originalImage, 0, 0, targetWidth, newHeight, null);
        g2d.dispose();

        return resizedImage;
    }

    /**
     * Generate a square QR code image, black modules on white
     */
    public static BufferedImage generateQRCode(String text, int size) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("QR content cannot be empty");
        }
        try {
            Map<EncodeHintType, Object> hints = new HashMap<>();
            hints.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.L);
            hints.put(EncodeHintType.CHARACTER_SET, "UTF-8");
            hints.put(EncodeHintType.MARGIN, 1);

            QRCodeWriter qrCodeWriter = new QRCodeWriter();
            BitMatrix bitMatrix = qrCodeWriter.encode(text, BarcodeFormat.QR_CODE, size, size, hints);

            BufferedImage qrImage = new BufferedImage(bitMatrix.getWidth(), bitMatrix.getHeight(), BufferedImage.TYPE_INT_RGB);
            for (int x = 0; x < bitMatrix.getWidth(); x++) {
                for (int y = 0; y < bitMatrix.getHeight(); y++) {
                    qrImage.setRGB(x, y, bitMatrix.get(x, y) ? 0x000000 : 0xFFFFFF);
                }
            }
            return qrImage;

        } catch (WriterException e) {
            logger.error("Error generating QR code: {}", e.getMessage());
            throw new IllegalArgumentException("Cannot encode QR code: " + e.getMessage(), e);
        }
    }
}
