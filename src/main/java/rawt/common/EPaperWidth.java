package rawt.common;

/**
 * Paper width classes supported by the receipt printers.
 * Dots are at 203 dpi (8 dots/mm) over the printable area.
 * @since 19/10/2026
 */
public enum EPaperWidth {
    MM_58(58, 384, 32, 2283),
    MM_80(80, 576, 48, 3150);

    private final int millimeters;
    private final int dots;
    private final int columns;
    private final int widthMils;

    EPaperWidth(int millimeters, int dots, int columns, int widthMils) {
        this.millimeters = millimeters;
        this.dots = dots;
        this.columns = columns;
        this.widthMils = widthMils;
    }

    public int getMillimeters() {
        return millimeters;
    }

    /**
     * Printable width in dots, used as the raster target width
     */
    public int getDots() {
        return dots;
    }

    /**
     * Characters per line in the default font
     */
    public int getColumns() {
        return columns;
    }

    public int getWidthMils() {
        return widthMils;
    }

    public static EPaperWidth fromMillimeters(int millimeters) {
        for (EPaperWidth width : values()) {
            if (width.millimeters == millimeters) {
                return width;
            }
        }
        throw new IllegalArgumentException("Unsupported paper width: " + millimeters + "mm");
    }
}
