package rawt.domain.raster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for FloydSteinbergQuantizer
 * @since 19/10/2026
 */
class FloydSteinbergQuantizerTest {

    private final FloydSteinbergQuantizer quantizer = new FloydSteinbergQuantizer();

    @Test
    @DisplayName("Should set every dot for a black image")
    void shouldSetEveryDotForBlack() {
        // Given
        PixelBuffer black = PixelBuffer.filled(16, 8, 0, 0, 0);

        // When
        ThermalRaster raster = quantizer.quantize(black);

        // Then
        assertThat(raster.getWidth()).isEqualTo(16);
        assertThat(raster.getHeight()).isEqualTo(8);
        assertThat(raster.getData()).hasSize(16).containsOnly((byte) 0xFF);
    }

    @Test
    @DisplayName("Should leave a white image blank")
    void shouldLeaveWhiteBlank() {
        ThermalRaster raster = quantizer.quantize(PixelBuffer.filled(16, 8, 255, 255, 255));

        assertThat(raster.getData()).containsOnly((byte) 0x00);
    }

    @Test
    @DisplayName("Should pad rows to whole bytes with clear bits")
    void shouldPadRows() {
        // When
        ThermalRaster raster = quantizer.quantize(PixelBuffer.filled(10, 3, 0, 0, 0));

        // Then
        assertThat(raster.getBytesPerRow()).isEqualTo(2);
        byte[] data = raster.getData();
        assertThat(data).hasSize(6);
        for (int row = 0; row < 3; row++) {
            assertThat(data[row * 2]).isEqualTo((byte) 0xFF);
            assertThat(data[row * 2 + 1]).isEqualTo((byte) 0xC0);
        }
    }

    @Test
    @DisplayName("Should reject an empty image")
    void shouldRejectEmptyImage() {
        assertThatThrownBy(() -> quantizer.quantize(new PixelBuffer(0, 5, new byte[0])))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should dither mid gray to roughly half the dots")
    void shouldDitherMidGray() {
        // Given
        PixelBuffer gray = PixelBuffer.filled(64, 64, 128, 128, 128);

        // When
        ThermalRaster raster = quantizer.quantize(gray);

        // Then
        int set = 0;
        for (int y = 0; y < 64; y++) {
            for (int x = 0; x < 64; x++) {
                if (raster.isDotSet(x, y)) {
                    set++;
                }
            }
        }
        assertThat(set / (double) (64 * 64)).isBetween(0.4, 0.6);
    }

    @Test
    @DisplayName("Should ignore alpha")
    void shouldIgnoreAlpha() {
        // Given
        byte[] rgba = new byte[8 * 1 * PixelBuffer.BYTES_PER_PIXEL];
        PixelBuffer transparentBlack = new PixelBuffer(8, 1, rgba);

        // When
        ThermalRaster raster = quantizer.quantize(transparentBlack);

        // Then
        assertThat(raster.getData()).containsExactly((byte) 0xFF);
    }

    @Test
    @DisplayName("Should produce the same raster for the same input")
    void shouldBeDeterministic() {
        // Given
        BufferedImage image = new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        for (int x = 0; x < 40; x++) {
            g.setColor(new Color(x * 6, 255 - x * 6, 100));
            g.drawLine(x, 0, x, 29);
        }
        g.dispose();
        PixelBuffer pixels = PixelBuffer.fromImage(image);

        // When
        ThermalRaster first = quantizer.quantize(pixels);
        ThermalRaster second = quantizer.quantize(pixels);

        // Then
        assertThat(first.getData()).isEqualTo(second.getData());
    }
}
