package rawt.domain.escpos;

import java.util.Locale;

/**
 * Barcode systems accepted by GS k (function B, length-prefixed data)
 * @since 19/10/2026
 */
public enum EBarcodeSymbology {
    UPC_A(65),
    UPC_E(66),
    EAN13(67),
    EAN8(68),
    CODE39(69),
    ITF(70),
    CODABAR(71),
    CODE93(72),
    CODE128(73);

    private final int code;

    EBarcodeSymbology(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Lenient name lookup: "UPC-A", "upc_a", "EAN-13" and "ean13" are all accepted
     * @throws IllegalArgumentException for symbologies outside the supported set
     */
    public static EBarcodeSymbology fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Barcode symbology is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (EBarcodeSymbology symbology : values()) {
            if (symbology.name().equals(normalized) || symbology.name().replace("_", "").equals(normalized.replace("_", ""))) {
                return symbology;
            }
        }
        throw new IllegalArgumentException("Unsupported barcode symbology: " + name);
    }
}
