package rawt.domain.job;

import rawt.common.EContentType;
import rawt.domain.escpos.TextStyle;

/**
 * Styled text, encoded with the settings in force when the job starts
 * @since 19/10/2026
 */
public record TextContent(String text, TextStyle style) implements IPrintContent {

    public TextContent {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        if (style == null) {
            style = TextStyle.plain();
        }
    }

    @Override
    public EContentType getType() {
        return EContentType.TEXT;
    }

    @Override
    public String getMimeType() {
        return "application/json";
    }
}
