package rawt.domain.escpos;

/**
 * Paper cut, GS V m
 * @since 19/10/2026
 */
public enum ECutMode {
    FULL(0x00),
    PARTIAL(0x01);

    private final int code;

    ECutMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
