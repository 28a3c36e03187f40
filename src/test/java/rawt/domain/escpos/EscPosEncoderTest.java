package rawt.domain.escpos;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rawt.domain.raster.ThermalRaster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for EscPosEncoder
 * @since 19/10/2026
 */
class EscPosEncoderTest {

    private static byte[] bytes(int... values) {
        byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }

    @Test
    @DisplayName("Should emit the basic control sequences")
    void shouldEmitBasicCommands() {
        // When
        byte[] data = new EscPosEncoder()
                .initialize()
                .align(EAlignment.CENTER)
                .bold(true)
                .underline(true)
                .fontSize(EFontSize.DOUBLE)
                .encode()
                .toByteArray();

        // Then
        assertThat(data).containsExactly(bytes(
                0x1B, 0x40,
                0x1B, 0x61, 0x01,
                0x1B, 0x45, 0x01,
                0x1B, 0x2D, 0x01,
                0x1D, 0x21, 0x11));
    }

    @Test
    @DisplayName("Should encode feed and cut")
    void shouldEncodeFeedAndCut() {
        byte[] data = new EscPosEncoder().feed(3).cut().cut(ECutMode.PARTIAL).encode().toByteArray();

        assertThat(data).containsExactly(bytes(0x1B, 0x64, 0x03, 0x1D, 0x56, 0x00, 0x1D, 0x56, 0x01));
    }

    @Test
    @DisplayName("Should clamp out of range parameters")
    void shouldClampParameters() {
        // When
        byte[] data = new EscPosEncoder()
                .feed(300)
                .beep(0, 20)
                .openDrawer(4)
                .density(12)
                .encode()
                .toByteArray();

        // Then
        assertThat(data).containsExactly(bytes(
                0x1B, 0x64, 0xFF,
                0x1B, 0x42, 0x01, 0x09,
                0x1B, 0x70, 0x01, 25, 250,
                0x1D, 0x7C, 0x07));
    }

    @Test
    @DisplayName("Should map density presets to levels")
    void shouldMapDensityPresets() {
        byte[] data = new EscPosEncoder()
                .density(EPrintDensity.LIGHT)
                .density(EPrintDensity.NORMAL)
                .density(EPrintDensity.DARK)
                .encode()
                .toByteArray();

        assertThat(data).containsExactly(bytes(0x1D, 0x7C, 1, 0x1D, 0x7C, 4, 0x1D, 0x7C, 7));
    }

    @Test
    @DisplayName("Should write raster header with byte width and dot height little-endian")
    void shouldWriteRasterHeader() {
        // Given
        ThermalRaster raster = new ThermalRaster(20, 300, new byte[3 * 300]);

        // When
        byte[] data = new EscPosEncoder().raster(raster).encode().toByteArray();

        // Then
        assertThat(data).hasSize(8 + 900);
        assertThat(data).startsWith(bytes(0x1D, 0x76, 0x30, 0x00, 0x03, 0x00, 0x2C, 0x01));
    }

    @Test
    @DisplayName("Should reject a raster taller than the 16-bit height field")
    void shouldRejectOversizedRaster() {
        // Given
        ThermalRaster raster = new ThermalRaster(8, 65536, new byte[65536]);
        EscPosEncoder encoder = new EscPosEncoder();

        // When / Then
        assertThatThrownBy(() -> encoder.raster(raster))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("65536 dots");
        assertThat(encoder.size()).isZero();
    }

    @Test
    @DisplayName("Should encode a barcode with height, width, text position and length-prefixed data")
    void shouldEncodeBarcode() {
        // When
        byte[] data = new EscPosEncoder().barcode("ABC", EBarcodeSymbology.CODE128, 80).encode().toByteArray();

        // Then
        assertThat(data).containsExactly(bytes(
                0x1D, 0x68, 80,
                0x1D, 0x77, 2,
                0x1D, 0x48, 2,
                0x1D, 0x6B, 73, 3, 'A', 'B', 'C'));
    }

    @Test
    @DisplayName("Should reject non ASCII barcode content")
    void shouldRejectNonAsciiBarcode() {
        assertThatThrownBy(() -> new EscPosEncoder().barcode("café", EBarcodeSymbology.CODE39, 50))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EscPosEncoder().barcode("", EBarcodeSymbology.CODE39, 50))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should encode a QR code with model, size, error correction, store and print blocks")
    void shouldEncodeQrCode() {
        // When
        byte[] data = new EscPosEncoder().qrCode("hi", 6).encode().toByteArray();

        // Then
        assertThat(data).containsExactly(bytes(
                0x1D, 0x28, 0x6B, 0x04, 0x00, 0x31, 0x41, 0x32, 0x00,
                0x1D, 0x28, 0x6B, 0x03, 0x00, 0x31, 0x43, 0x06,
                0x1D, 0x28, 0x6B, 0x03, 0x00, 0x31, 0x45, 0x30,
                0x1D, 0x28, 0x6B, 0x05, 0x00, 0x31, 0x50, 0x30, 'h', 'i',
                0x1D, 0x28, 0x6B, 0x03, 0x00, 0x31, 0x51, 0x30));
    }

    @Test
    @DisplayName("Should encode text in the selected character set")
    void shouldEncodeTextInCharset() {
        assertThat(new EscPosEncoder(ETextEncoding.CP437).text("é").encode().toByteArray())
                .containsExactly(bytes(0x82));
        assertThat(new EscPosEncoder(ETextEncoding.GB2312).text("中").encode().toByteArray())
                .containsExactly(bytes(0xD6, 0xD0));
        assertThat(new EscPosEncoder().line("é").encode().toByteArray())
                .containsExactly(bytes(0xC3, 0xA9, 0x0A));
    }

    @Test
    @DisplayName("Should reject text the character set cannot represent")
    void shouldRejectUnmappableText() {
        assertThatThrownBy(() -> new EscPosEncoder(ETextEncoding.CP437).text("中"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CP437");
    }

    @Test
    @DisplayName("Should lay out key and value across the line width")
    void shouldLayoutKeyValue() {
        // When
        byte[] data = new EscPosEncoder().keyValue("Tea", "$2.00", 12).encode().toByteArray();

        // Then
        assertThat(new String(data, java.nio.charset.StandardCharsets.US_ASCII)).isEqualTo("Tea    $2.00\n");
    }

    @Test
    @DisplayName("Should clear accumulated commands")
    void shouldClear() {
        EscPosEncoder encoder = new EscPosEncoder().initialize().line("x");

        encoder.clear();

        assertThat(encoder.size()).isZero();
        assertThat(encoder.encode().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should look up symbologies and encodings leniently")
    void shouldLookUpNames() {
        assertThat(EBarcodeSymbology.fromName("ean-13")).isEqualTo(EBarcodeSymbology.EAN13);
        assertThat(EBarcodeSymbology.fromName("UPC-A")).isEqualTo(EBarcodeSymbology.UPC_A);
        assertThat(ETextEncoding.fromName("utf8")).isEqualTo(ETextEncoding.UTF_8);
        assertThat(ETextEncoding.fromName("cp437")).isEqualTo(ETextEncoding.CP437);
        assertThatThrownBy(() -> EBarcodeSymbology.fromName("PDF417")).isInstanceOf(IllegalArgumentException.class);
    }
}
