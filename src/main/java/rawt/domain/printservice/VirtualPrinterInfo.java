package rawt.domain.printservice;

/**
 * @since 19/10/2026
 */
public record VirtualPrinterInfo(String id, String name, EPrinterStatus status, String description,
                                 PrinterCapabilities capabilities) {
}
