package rawt.domain.raster;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Packed 1-bit raster: 8 pixels per byte, MSB first, bit set = print a dot.
 * Each row is padded to the nearest byte boundary.
 * @since 19/10/2026
 */
public final class ThermalRaster {
    private final int width;
    private final int height;
    private final byte[] data;

    public ThermalRaster(int width, int height, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        int expected = bytesPerRow(width) * height;
        if (data == null || data.length != expected) {
            throw new IllegalArgumentException("Raster data must be " + expected + " bytes");
        }
        this.width = width;
        this.height = height;
        this.data = Arrays.copyOf(data, data.length);
    }

    public static int bytesPerRow(int width) {
        return (width + 7) / 8;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getBytesPerRow() {
        return bytesPerRow(width);
    }

    public boolean isDotSet(int x, int y) {
        int index = y * getBytesPerRow() + x / 8;
        return (data[index] & (0x80 >> (x % 8))) != 0;
    }

    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    public void writeTo(ByteArrayOutputStream out) {
        out.write(data, 0, data.length);
    }

    @Override
    public String toString() {
        return "ThermalRaster{" + width + "x" + height + ", " + data.length + " bytes}";
    }
}
