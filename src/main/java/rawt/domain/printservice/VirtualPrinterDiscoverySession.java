package rawt.domain.printservice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.PrinterSettingsStore;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reports printers to the host print subsystem.
 * Always exactly one virtual printer, whatever is saved in the settings; the real printer
 * behind it is chosen in the app.
 * @since 19/10/2026
 */
public class VirtualPrinterDiscoverySession {
    private static final Logger logger = LoggerFactory.getLogger(VirtualPrinterDiscoverySession.class);

    public static final String VIRTUAL_PRINTER_ID = "raw_thermal_virtual";
    public static final String VIRTUAL_PRINTER_NAME = "Raw Thermal";
    public static final String VIRTUAL_PRINTER_DESCRIPTION = "Thermal printer via Bluetooth";

    private final PrinterSettingsStore settingsStore;
    private final IPrinterDiscoveryListener listener;
    private final Set<String> trackedPrinters = ConcurrentHashMap.newKeySet();
    private volatile boolean discovering;

    public VirtualPrinterDiscoverySession(PrinterSettingsStore settingsStore, IPrinterDiscoveryListener listener) {
        this.settingsStore = settingsStore;
        this.listener = listener;
    }

    public void startDiscovery() {
        logger.debug("Starting printer discovery");
        discovering = true;
        reportPrinters();
    }

    public void stopDiscovery() {
        logger.debug("Stopping printer discovery");
        discovering = false;
    }

    /**
     * @return the ids that are still valid; only the virtual printer is
     */
    public List<String> validatePrinters(List<String> printerIds) {
        logger.debug("Validating {} printer(s)", printerIds.size());
        return printerIds.contains(VIRTUAL_PRINTER_ID) ? List.of(VIRTUAL_PRINTER_ID) : Collections.emptyList();
    }

    public void startTracking(String printerId) {
        logger.debug("Start tracking printer: {}", printerId);
        trackedPrinters.add(printerId);
        reportPrinters();
    }

    public void stopTracking(String printerId) {
        logger.debug("Stop tracking printer: {}", printerId);
        trackedPrinters.remove(printerId);
    }

    public boolean isDiscovering() {
        return discovering;
    }

    public boolean isTracking(String printerId) {
        return trackedPrinters.contains(printerId);
    }

    public VirtualPrinterInfo getVirtualPrinter() {
        return new VirtualPrinterInfo(VIRTUAL_PRINTER_ID, VIRTUAL_PRINTER_NAME, EPrinterStatus.IDLE,
                VIRTUAL_PRINTER_DESCRIPTION,
                PrinterCapabilities.forPaperWidth(settingsStore.getAppSettings().defaultPaperWidth()));
    }

    private void reportPrinters() {
        logger.debug("Reporting virtual printer: {}", VIRTUAL_PRINTER_NAME);
        try {
            listener.onPrintersAdded(List.of(getVirtualPrinter()));
        } catch (Exception e) {
            logger.error("Error notifying discovery listener: {}", e.getMessage());
        }
    }
}
