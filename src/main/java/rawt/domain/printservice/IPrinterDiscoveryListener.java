package rawt.domain.printservice;

import java.util.List;

/**
 * Receives the printers a discovery session reports
 * @since 19/10/2026
 */
public interface IPrinterDiscoveryListener {
    void onPrintersAdded(List<VirtualPrinterInfo> printers);

    default void onPrintersRemoved(List<String> printerIds) {
    }
}
