package rawt.domain.escpos;

/**
 * Text justification, ESC a n
 * @since 19/10/2026
 */
public enum EAlignment {
    LEFT(0),
    CENTER(1),
    RIGHT(2);

    private final int code;

    EAlignment(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
