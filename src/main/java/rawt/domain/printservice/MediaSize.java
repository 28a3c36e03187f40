package rawt.domain.printservice;

import rawt.common.EPaperWidth;

/**
 * Media size advertised to the host, in mils (1/1000 inch)
 * @since 19/10/2026
 */
public record MediaSize(String id, String label, int widthMils, int heightMils) {
    /** Roll paper has no real length */
    public static final int ROLL_HEIGHT_MILS = 100000;

    public static final MediaSize THERMAL_58MM = thermal(EPaperWidth.MM_58);
    public static final MediaSize THERMAL_80MM = thermal(EPaperWidth.MM_80);
    public static final MediaSize ISO_A4 = new MediaSize("ISO_A4", "A4", 8270, 11690);
    public static final MediaSize NA_LETTER = new MediaSize("NA_LETTER", "Letter", 8500, 11000);

    public MediaSize {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Media size id cannot be empty");
        }
        if (widthMils <= 0 || heightMils <= 0) {
            throw new IllegalArgumentException("Media size must be positive: " + widthMils + "x" + heightMils);
        }
    }

    public static MediaSize thermal(EPaperWidth paperWidth) {
        int mm = paperWidth.getMillimeters();
        return new MediaSize("THERMAL_" + mm + "MM", mm + "mm Thermal Roll", paperWidth.getWidthMils(), ROLL_HEIGHT_MILS);
    }
}
