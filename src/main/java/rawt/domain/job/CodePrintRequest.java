package rawt.domain.job;

/**
 * QR code, barcode and raw print request DTO.
 * For raw prints {@code content} holds base64 encoded command bytes.
 * @since 19/10/2026
 */
public class CodePrintRequest {
    private String title;
    private String content;
    private String symbology = "CODE128";
    private int height = 80;
    private int size = 6;
    private boolean asImage;

    public String getTitle() {
        return title;
    }
    public void setTitle(String title) {
        this.title = title;
    }

    public String getContent() {
        return content;
    }
    public void setContent(String content) {
        this.content = content;
    }

    public String getSymbology() {
        return symbology;
    }
    public void setSymbology(String symbology) {
        this.symbology = symbology;
    }

    public int getHeight() {
        return height;
    }
    public void setHeight(int height) {
        this.height = height;
    }

    public int getSize() {
        return size;
    }
    public void setSize(int size) {
        this.size = size;
    }

    public boolean isAsImage() {
        return asImage;
    }
    public void setAsImage(boolean asImage) {
        this.asImage = asImage;
    }
}
