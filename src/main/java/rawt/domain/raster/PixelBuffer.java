package rawt.domain.raster;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Row-major RGBA pixel buffer, 4 bytes per pixel. Immutable once produced.
 * @since 19/10/2026
 */
public final class PixelBuffer {
    public static final int BYTES_PER_PIXEL = 4;

    private final int width;
    private final int height;
    private final byte[] rgba;

    public PixelBuffer(int width, int height, byte[] rgba) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative dimensions: " + width + "x" + height);
        }
        if (rgba == null || rgba.length != width * height * BYTES_PER_PIXEL) {
            throw new IllegalArgumentException("Pixel data length does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.rgba = Arrays.copyOf(rgba, rgba.length);
    }

    /**
     * Copy an AWT image into RGBA order
     */
    public static PixelBuffer fromImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] data = new byte[width * height * BYTES_PER_PIXEL];
        int[] row = new int[width];

        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                int offset = (y * width + x) * BYTES_PER_PIXEL;
                data[offset] = (byte) ((argb >> 16) & 0xFF);
                data[offset + 1] = (byte) ((argb >> 8) & 0xFF);
                data[offset + 2] = (byte) (argb & 0xFF);
                data[offset + 3] = (byte) ((argb >> 24) & 0xFF);
            }
        }
        return new PixelBuffer(width, height, data);
    }

    /**
     * Buffer of one opaque color
     */
    public static PixelBuffer filled(int width, int height, int red, int green, int blue) {
        byte[] data = new byte[width * height * BYTES_PER_PIXEL];
        for (int i = 0; i < data.length; i += BYTES_PER_PIXEL) {
            data[i] = (byte) red;
            data[i + 1] = (byte) green;
            data[i + 2] = (byte) blue;
            data[i + 3] = (byte) 0xFF;
        }
        return new PixelBuffer(width, height, data);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int red(int x, int y) {
        return rgba[(y * width + x) * BYTES_PER_PIXEL] & 0xFF;
    }

    public int green(int x, int y) {
        return rgba[(y * width + x) * BYTES_PER_PIXEL + 1] & 0xFF;
    }

    public int blue(int x, int y) {
        return rgba[(y * width + x) * BYTES_PER_PIXEL + 2] & 0xFF;
    }

    public int alpha(int x, int y) {
        return rgba[(y * width + x) * BYTES_PER_PIXEL + 3] & 0xFF;
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + width + "x" + height + "}";
    }
}
