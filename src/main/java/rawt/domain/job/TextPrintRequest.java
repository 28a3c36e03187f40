package rawt.domain.job;

/**
 * Text print request DTO
 * @since 19/10/2026
 */
public class TextPrintRequest {
    private String title;
    private String text;
    private String alignment = "LEFT"; // LEFT, CENTER, RIGHT
    private boolean bold;
    private boolean underline;
    private boolean doubleSize;

    public String getTitle() {
        return title;
    }
    public void setTitle(String title) {
        this.title = title;
    }

    public String getText() {
        return text;
    }
    public void setText(String text) {
        this.text = text;
    }

    public String getAlignment() {
        return alignment;
    }
    public void setAlignment(String alignment) {
        this.alignment = alignment;
    }

    public boolean isBold() {
        return bold;
    }
    public void setBold(boolean bold) {
        this.bold = bold;
    }

    public boolean isUnderline() {
        return underline;
    }
    public void setUnderline(boolean underline) {
        this.underline = underline;
    }

    public boolean isDoubleSize() {
        return doubleSize;
    }
    public void setDoubleSize(boolean doubleSize) {
        this.doubleSize = doubleSize;
    }
}
