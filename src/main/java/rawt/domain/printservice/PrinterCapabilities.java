package rawt.domain.printservice;

import rawt.common.EPaperWidth;
import rawt.common.EscPosConstants;

import java.util.List;

/**
 * What the virtual printer accepts: thermal rolls plus office sizes that get scaled down
 * @since 19/10/2026
 */
public record PrinterCapabilities(List<MediaSize> mediaSizes, MediaSize defaultMediaSize,
                                  int dpi, EColorMode colorMode) {

    public PrinterCapabilities {
        mediaSizes = List.copyOf(mediaSizes);
        if (!mediaSizes.contains(defaultMediaSize)) {
            throw new IllegalArgumentException("Default media size is not offered: " + defaultMediaSize);
        }
    }

    public static PrinterCapabilities forPaperWidth(EPaperWidth paperWidth) {
        MediaSize defaultSize = paperWidth == EPaperWidth.MM_58 ? MediaSize.THERMAL_58MM : MediaSize.THERMAL_80MM;
        return new PrinterCapabilities(
                List.of(MediaSize.THERMAL_58MM, MediaSize.THERMAL_80MM, MediaSize.ISO_A4, MediaSize.NA_LETTER),
                defaultSize,
                EscPosConstants.PRINTER_DPI,
                EColorMode.MONOCHROME);
    }
}
