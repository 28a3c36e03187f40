package rawt.domain.escpos;

/**
 * Character size, GS ! n (high nibble = width multiplier, low nibble = height multiplier)
 * @since 19/10/2026
 */
public enum EFontSize {
    NORMAL(0x00),
    DOUBLE_HEIGHT(0x01),
    DOUBLE_WIDTH(0x10),
    DOUBLE(0x11);

    private final int code;

    EFontSize(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
