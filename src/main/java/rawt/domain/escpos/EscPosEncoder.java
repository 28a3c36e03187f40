package rawt.domain.escpos;

import rawt.common.EscPosConstants;
import rawt.domain.raster.ThermalRaster;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static rawt.common.EscPosConstants.ESC;
import static rawt.common.EscPosConstants.GS;
import static rawt.common.EscPosConstants.LF;

/**
 * Chained builder for ESC/POS command streams.
 *
 * <p>Every call appends a fixed byte sequence and returns the builder. Numeric arguments
 * outside the protocol range are clamped, never rejected. Inputs that cannot be represented
 * at all (unmappable text, unsupported barcode data) raise {@link IllegalArgumentException}
 * and leave the buffer untouched. No I/O happens here.</p>
 *
 * <pre>
 * CommandBuffer buffer = new EscPosEncoder()
 *         .initialize()
 *         .align(EAlignment.CENTER)
 *         .bold(true)
 *         .line("TOTAL")
 *         .bold(false)
 *         .feed(3)
 *         .cut(ECutMode.FULL)
 *         .encode();
 * </pre>
 *
 * @since 19/10/2026
 */
public class EscPosEncoder {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private ETextEncoding textEncoding;

    public EscPosEncoder() {
        this(ETextEncoding.UTF_8);
    }

    public EscPosEncoder(ETextEncoding textEncoding) {
        this.textEncoding = textEncoding == null ? ETextEncoding.UTF_8 : textEncoding;
    }

    public ETextEncoding getTextEncoding() {
        return textEncoding;
    }

    /**
     * Encoding applied to subsequent text calls
     */
    public EscPosEncoder textEncoding(ETextEncoding encoding) {
        this.textEncoding = encoding == null ? ETextEncoding.UTF_8 : encoding;
        return this;
    }

    /**
     * ESC @ - reset printer to power-on defaults
     */
    public EscPosEncoder initialize() {
        return append(ESC, 0x40);
    }

    public EscPosEncoder align(EAlignment alignment) {
        return append(ESC, 0x61, alignment.getCode());
    }

    public EscPosEncoder bold(boolean enabled) {
        return append(ESC, 0x45, enabled ? 1 : 0);
    }

    public EscPosEncoder underline(boolean enabled) {
        return append(ESC, 0x2D, enabled ? 1 : 0);
    }

    public EscPosEncoder fontSize(EFontSize size) {
        return append(GS, 0x21, size.getCode());
    }

    public EscPosEncoder text(String content) {
        byte[] bytes = textEncoding.encode(content);
        buffer.write(bytes, 0, bytes.length);
        return this;
    }

    public EscPosEncoder newline() {
        return append(LF);
    }

    public EscPosEncoder line(String content) {
        return text(content).newline();
    }

    /**
     * ESC d n - print and feed n lines
     */
    public EscPosEncoder feed(int lines) {
        return append(ESC, 0x64, clamp(lines, 0, EscPosConstants.MAX_FEED_LINES));
    }

    public EscPosEncoder cut(ECutMode mode) {
        return append(GS, 0x56, mode.getCode());
    }

    public EscPosEncoder cut() {
        return cut(ECutMode.FULL);
    }

    /**
     * GS v 0 - raster bit image, normal scale.
     * Width field is in bytes, height field in dots, both little-endian.
     * @throws IllegalArgumentException if either dimension does not fit its 16-bit field
     */
    public EscPosEncoder raster(ThermalRaster raster) {
        int widthBytes = raster.getBytesPerRow();
        int height = raster.getHeight();
        if (widthBytes > EscPosConstants.MAX_RASTER_FIELD || height > EscPosConstants.MAX_RASTER_FIELD) {
            throw new IllegalArgumentException("Raster too large for GS v 0: " + widthBytes + " bytes x " + height + " dots");
        }
        append(GS, 0x76, 0x30, 0x00,
                widthBytes & 0xFF, (widthBytes >> 8) & 0xFF,
                height & 0xFF, (height >> 8) & 0xFF);
        raster.writeTo(buffer);
        return this;
    }

    /**
     * Barcode with human readable text below, medium module width
     */
    public EscPosEncoder barcode(String content, EBarcodeSymbology symbology, int height) {
        if (symbology == null) {
            throw new IllegalArgumentException("Barcode symbology is required");
        }
        byte[] data = asciiBarcodeData(content);

        append(GS, 0x68, clamp(height, 1, EscPosConstants.MAX_BARCODE_HEIGHT));
        append(GS, 0x77, EscPosConstants.BARCODE_MODULE_WIDTH);
        append(GS, 0x48, EscPosConstants.BARCODE_HRI_BELOW);
        append(GS, 0x6B, symbology.getCode(), data.length);
        buffer.write(data, 0, data.length);
        return this;
    }

    /**
     * QR code, model 2, error correction level L
     */
    public EscPosEncoder qrCode(String content, int moduleSize) {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("QR content cannot be empty");
        }
        byte[] data = content.getBytes(StandardCharsets.UTF_8);
        if (data.length > EscPosConstants.MAX_QR_DATA_LENGTH) {
            throw new IllegalArgumentException("QR content exceeds " + EscPosConstants.MAX_QR_DATA_LENGTH + " bytes");
        }
        int storeLength = data.length + 3;
        int size = clamp(moduleSize, EscPosConstants.MIN_QR_MODULE_SIZE, EscPosConstants.MAX_QR_MODULE_SIZE);

        append(GS, 0x28, 0x6B, 0x04, 0x00, 0x31, 0x41, 0x32, 0x00);
        append(GS, 0x28, 0x6B, 0x03, 0x00, 0x31, 0x43, size);
        append(GS, 0x28, 0x6B, 0x03, 0x00, 0x31, 0x45, 0x30);
        append(GS, 0x28, 0x6B, storeLength & 0xFF, (storeLength >> 8) & 0xFF, 0x31, 0x50, 0x30);
        buffer.write(data, 0, data.length);
        append(GS, 0x28, 0x6B, 0x03, 0x00, 0x31, 0x51, 0x30);
        return this;
    }

    /**
     * ESC p m t1 t2 - kick the cash drawer on connector pin 2 (0) or pin 5 (1)
     */
    public EscPosEncoder openDrawer(int pin) {
        return append(ESC, 0x70, clamp(pin, 0, 1),
                EscPosConstants.DRAWER_PULSE_ON, EscPosConstants.DRAWER_PULSE_OFF);
    }

    /**
     * ESC B n t - buzzer, not available on every model
     */
    public EscPosEncoder beep(int count, int duration) {
        return append(ESC, 0x42,
                clamp(count, 1, EscPosConstants.MAX_BEEP_VALUE),
                clamp(duration, 1, EscPosConstants.MAX_BEEP_VALUE));
    }

    /**
     * GS | n - print density level
     */
    public EscPosEncoder density(int level) {
        return append(GS, 0x7C, clamp(level, 0, EscPosConstants.MAX_DENSITY));
    }

    public EscPosEncoder density(EPrintDensity density) {
        return density(density.getLevel());
    }

    public EscPosEncoder horizontalRule(char ch, int width) {
        return line(String.valueOf(ch).repeat(Math.max(0, width)));
    }

    /**
     * Centered double size bold title, optional subtitle, then a rule; leaves alignment at left
     */
    public EscPosEncoder header(String title, String subtitle, int width) {
        align(EAlignment.CENTER)
                .fontSize(EFontSize.DOUBLE)
                .bold(true)
                .line(title)
                .fontSize(EFontSize.NORMAL)
                .bold(false);
        if (subtitle != null && !subtitle.isEmpty()) {
            line(subtitle);
        }
        return horizontalRule('-', width).align(EAlignment.LEFT);
    }

    /**
     * Key flush left, value flush right; at least one space between them
     */
    public EscPosEncoder keyValue(String key, String value, int width) {
        int spaces = width - key.length() - value.length();
        return line(key + " ".repeat(Math.max(1, spaces)) + value);
    }

    public int size() {
        return buffer.size();
    }

    public CommandBuffer encode() {
        return CommandBuffer.of(buffer.toByteArray());
    }

    public EscPosEncoder clear() {
        buffer.reset();
        return this;
    }

    private EscPosEncoder append(int... bytes) {
        for (int b : bytes) {
            buffer.write(b);
        }
        return this;
    }

    private static byte[] asciiBarcodeData(String content) {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("Barcode content cannot be empty");
        }
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) > 0x7F) {
                throw new IllegalArgumentException("Barcode content must be ASCII");
            }
        }
        byte[] data = content.getBytes(StandardCharsets.US_ASCII);
        if (data.length > EscPosConstants.MAX_BARCODE_LENGTH) {
            throw new IllegalArgumentException("Barcode content exceeds " + EscPosConstants.MAX_BARCODE_LENGTH + " bytes");
        }
        return data;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
