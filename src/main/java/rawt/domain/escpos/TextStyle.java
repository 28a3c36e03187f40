package rawt.domain.escpos;

/**
 * Formatting applied to a plain text job
 * @since 19/10/2026
 */
public record TextStyle(EAlignment alignment, boolean bold, boolean underline, boolean doubleSize) {

    public static TextStyle plain() {
        return new TextStyle(EAlignment.LEFT, false, false, false);
    }

    public TextStyle {
        if (alignment == null) {
            alignment = EAlignment.LEFT;
        }
    }
}
