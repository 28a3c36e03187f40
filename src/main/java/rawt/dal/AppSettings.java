package rawt.dal;

import rawt.common.EPaperWidth;
import rawt.common.EscPosConstants;
import rawt.domain.escpos.EPrintDensity;
import rawt.domain.escpos.ETextEncoding;

/**
 * User print preferences
 * @since 19/10/2026
 */
public record AppSettings(EPaperWidth defaultPaperWidth, boolean autoCut, int feedLinesAfterPrint,
                          ETextEncoding encoding, EPrintDensity printDensity) {

    public static AppSettings defaults() {
        return new AppSettings(EPaperWidth.MM_58, true, EscPosConstants.DEFAULT_FEED_LINES,
                ETextEncoding.UTF_8, EPrintDensity.NORMAL);
    }

    public AppSettings {
        if (defaultPaperWidth == null) {
            defaultPaperWidth = EPaperWidth.MM_58;
        }
        if (encoding == null) {
            encoding = ETextEncoding.UTF_8;
        }
        if (printDensity == null) {
            printDensity = EPrintDensity.NORMAL;
        }
        if (feedLinesAfterPrint < 0 || feedLinesAfterPrint > EscPosConstants.MAX_FEED_LINES) {
            throw new IllegalArgumentException("Feed lines must be between 0 and " + EscPosConstants.MAX_FEED_LINES);
        }
    }
}
