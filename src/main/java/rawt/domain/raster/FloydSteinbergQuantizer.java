package rawt.domain.raster;

import rawt.common.EscPosConstants;

/**
 * Converts a color pixel buffer to a 1-bit thermal raster using Floyd–Steinberg error diffusion.
 *
 * <p>Luminance is {@code 0.299R + 0.587G + 0.114B}; alpha is ignored, so transparent
 * sources must be composited onto white before quantizing (see {@link GraphUtils}).
 * Pixels are visited in raster order and the quantization error is pushed to the right (7/16),
 * lower-left (3/16), below (5/16) and lower-right (1/16) neighbours that exist.</p>
 *
 * <p>Stateless and deterministic: the same input always produces the same raster.</p>
 *
 * @since 19/10/2026
 */
public class FloydSteinbergQuantizer {

    public ThermalRaster quantize(PixelBuffer pixels) {
        int width = pixels.getWidth();
        int height = pixels.getHeight();
        if (width == 0 || height == 0) {
            throw new IllegalArgumentException("Cannot quantize an empty image: " + width + "x" + height);
        }

        float[] gray = new float[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                gray[y * width + x] = 0.299f * pixels.red(x, y)
                        + 0.587f * pixels.green(x, y)
                        + 0.114f * pixels.blue(x, y);
            }
        }

        int bytesPerRow = ThermalRaster.bytesPerRow(width);
        byte[] packed = new byte[bytesPerRow * height];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int index = y * width + x;
                float oldValue = gray[index];
                float newValue = oldValue < EscPosConstants.GRAYSCALE_THRESHOLD ? 0f : 255f;
                float error = oldValue - newValue;

                if (newValue == 0f) {
                    packed[y * bytesPerRow + x / 8] |= (byte) (0x80 >> (x % 8));
                }

                if (x + 1 < width) {
                    gray[index + 1] += error * 7 / 16;
                }
                if (y + 1 < height) {
                    if (x > 0) {
                        gray[index + width - 1] += error * 3 / 16;
                    }
                    gray[index + width] += error * 5 / 16;
                    if (x + 1 < width) {
                        gray[index + width + 1] += error * 1 / 16;
                    }
                }
            }
        }

        return new ThermalRaster(width, height, packed);
    }
}
