package rawt.common;

/**
 * ESC/POS control bytes and limits
 * @since 19/10/2026
 */
public final class EscPosConstants {
    private EscPosConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final byte ESC = 0x1B;
    public static final byte GS = 0x1D;
    public static final byte LF = 0x0A;

    public static final int MAX_FEED_LINES = 255;
    public static final int MAX_BARCODE_HEIGHT = 255;
    public static final int MAX_BARCODE_LENGTH = 255;
    public static final int BARCODE_MODULE_WIDTH = 2;
    public static final int BARCODE_HRI_BELOW = 2;
    public static final int MIN_QR_MODULE_SIZE = 1;
    public static final int MAX_QR_MODULE_SIZE = 16;
    public static final int MAX_QR_DATA_LENGTH = 7089;
    public static final int MAX_BEEP_VALUE = 9;
    public static final int MAX_DENSITY = 7;
    // GS v 0 width (bytes) and height (dots) are 16-bit fields
    public static final int MAX_RASTER_FIELD = 0xFFFF;

    // Cash drawer kick pulse timing (x2 ms)
    public static final int DRAWER_PULSE_ON = 25;
    public static final int DRAWER_PULSE_OFF = 250;

    public static final int GRAYSCALE_THRESHOLD = 128;
    public static final int PRINTER_DPI = 203;
    public static final int TRAILING_FEED_LINES = 2;
    public static final int DEFAULT_FEED_LINES = 3;
}
