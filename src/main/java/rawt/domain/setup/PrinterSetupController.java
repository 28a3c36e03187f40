package rawt.domain.setup;

import com.google.gson.Gson;
import io.javalin.http.Context;
import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.AppSettings;
import rawt.dal.PrinterSettingsStore;
import rawt.dal.SavedPrinter;
import rawt.dal.StoreException;
import rawt.domain.ApiResponse;
import rawt.domain.SSEManager;
import rawt.domain.link.DiscoveredDevice;
import rawt.domain.link.ILinkTransport;
import rawt.domain.link.LinkException;
import rawt.domain.printservice.VirtualPrinterDiscoverySession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.javalin.apibuilder.ApiBuilder.*;

/**
 * REST Controller for saved printers, app settings and device scanning.
 * Selecting a current printer releases jobs waiting for one.
 * @since 19/10/2026
 */
public class PrinterSetupController {
    private static final Logger logger = LoggerFactory.getLogger(PrinterSetupController.class);

    private final PrinterSettingsStore settingsStore;
    private final ILinkTransport transport;
    private final VirtualPrinterDiscoverySession discoverySession;
    private final SSEManager sseManager;
    private final Gson compactGson = new Gson();

    private final Map<String, DiscoveredDevice> foundDevices = new LinkedHashMap<>();
    private Disposable scanSubscription;

    public PrinterSetupController(PrinterSettingsStore settingsStore, ILinkTransport transport,
                                  VirtualPrinterDiscoverySession discoverySession, SSEManager sseManager) {
        this.settingsStore = settingsStore;
        this.transport = transport;
        this.discoverySession = discoverySession;
        this.sseManager = sseManager;
    }

    /**
     * Register all setup REST API routes
     */
    public void registerRoutes() {
        path("/api/printers", () -> {
            get(this::listPrinters);
            post(this::savePrinter);
            get("/current", this::getCurrentPrinter);
            put("/current", this::selectCurrentPrinter);
            delete("/current", this::clearCurrentPrinter);
            delete("/{id}", this::removePrinter);
        });

        path("/api/settings", () -> {
            get(this::getSettings);
            put(this::updateSettings);
        });

        path("/api/devices", () -> {
            get(this::listDevices);
            post("/scan", this::startScan);
            post("/scan/stop", this::stopScan);
        });

        path("/api/link", () -> {
            get("/status", this::getLinkStatus);
        });

        path("/api/virtual-printer", () -> {
            get(this::getVirtualPrinter);
        });
    }

    private void listPrinters(Context ctx) {
        ctx.json(ApiResponse.success(settingsStore.getSavedPrinters()));
    }

    private void savePrinter(Context ctx) {
        try {
            SavedPrinter printer = ctx.bodyAsClass(SavedPrinter.class);
            if (printer == null) {
                ctx.status(400).json(ApiResponse.error("Printer is required"));
                return;
            }
            settingsStore.savePrinter(printer);
            ctx.json(ApiResponse.success("Printer saved", printer));
        } catch (StoreException e) {
            logger.error("Error saving printer", e);
            ctx.status(500).json(ApiResponse.error("Save failed: " + e.getMessage()));
        } catch (RuntimeException e) {
            logger.warn("Invalid printer: {}", e.getMessage());
            ctx.status(400).json(ApiResponse.error("Invalid printer: " + e.getMessage()));
        }
    }

    private void removePrinter(Context ctx) {
        String id = ctx.pathParam("id");
        try {
            if (settingsStore.removePrinter(id)) {
                ctx.json(ApiResponse.success("Printer removed", id));
            } else {
                ctx.status(404).json(ApiResponse.error("Printer not found: " + id));
            }
        } catch (StoreException e) {
            logger.error("Error removing printer {}", id, e);
            ctx.status(500).json(ApiResponse.error("Remove failed: " + e.getMessage()));
        }
    }

    private void getCurrentPrinter(Context ctx) {
        settingsStore.getCurrentPrinter().ifPresentOrElse(
                printer -> ctx.json(ApiResponse.success(printer)),
                () -> ctx.status(404).json(ApiResponse.error("No printer configured")));
    }

    /**
     * Body: {@code {"id": "..."}}
     */
    private void selectCurrentPrinter(Context ctx) {
        PrinterSelection selection = ctx.bodyAsClass(PrinterSelection.class);
        if (selection == null || selection.getId() == null || selection.getId().isBlank()) {
            ctx.status(400).json(ApiResponse.error("Printer id is required"));
            return;
        }
        try {
            SavedPrinter printer = settingsStore.setCurrentPrinter(selection.getId());
            logger.info("Current printer set to {}", printer);
            ctx.json(ApiResponse.success("Current printer set", printer));
        } catch (IllegalArgumentException e) {
            ctx.status(404).json(ApiResponse.error(e.getMessage()));
        } catch (StoreException e) {
            logger.error("Error selecting printer {}", selection.getId(), e);
            ctx.status(500).json(ApiResponse.error("Select failed: " + e.getMessage()));
        }
    }

    private void clearCurrentPrinter(Context ctx) {
        try {
            settingsStore.clearCurrentPrinter();
            ctx.json(ApiResponse.success("Current printer cleared", null));
        } catch (StoreException e) {
            logger.error("Error clearing current printer", e);
            ctx.status(500).json(ApiResponse.error("Clear failed: " + e.getMessage()));
        }
    }

    private void getSettings(Context ctx) {
        ctx.json(ApiResponse.success(settingsStore.getAppSettings()));
    }

    private void updateSettings(Context ctx) {
        try {
            AppSettings settings = ctx.bodyAsClass(AppSettings.class);
            if (settings == null) {
                ctx.status(400).json(ApiResponse.error("Settings are required"));
                return;
            }
            settingsStore.updateAppSettings(settings);
            ctx.json(ApiResponse.success("Settings updated", settings));
        } catch (StoreException e) {
            logger.error("Error updating settings", e);
            ctx.status(500).json(ApiResponse.error("Update failed: " + e.getMessage()));
        } catch (RuntimeException e) {
            logger.warn("Invalid settings: {}", e.getMessage());
            ctx.status(400).json(ApiResponse.error("Invalid settings: " + e.getMessage()));
        }
    }

    private void startScan(Context ctx) {
        try {
            synchronized (foundDevices) {
                if (scanSubscription == null || scanSubscription.isDisposed()) {
                    foundDevices.clear();
                    scanSubscription = transport.startScan().subscribe(
                            this::onDeviceFound,
                            error -> logger.error("Scan failed: {}", error.getMessage()));
                }
            }
            ctx.json(ApiResponse.success("Scan started", listFoundDevices()));
        } catch (LinkException e) {
            logger.warn("Cannot start scan: {}", e.getMessage());
            ctx.status(503).json(ApiResponse.error(e.getMessage()));
        }
    }

    private void stopScan(Context ctx) {
        transport.stopScan();
        synchronized (foundDevices) {
            if (scanSubscription != null) {
                scanSubscription.dispose();
                scanSubscription = null;
            }
        }
        ctx.json(ApiResponse.success("Scan stopped", listFoundDevices()));
    }

    private void onDeviceFound(DiscoveredDevice device) {
        synchronized (foundDevices) {
            foundDevices.put(device.id(), device);
        }
        logger.debug("Device found: {} ({})", device.name(), device.id());
        sseManager.broadcast("device", compactGson.toJson(device));
    }

    private List<DiscoveredDevice> listFoundDevices() {
        synchronized (foundDevices) {
            return new ArrayList<>(foundDevices.values());
        }
    }

    private void listDevices(Context ctx) {
        ctx.json(ApiResponse.success(listFoundDevices()));
    }

    private void getLinkStatus(Context ctx) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", transport.getState());
        status.put("scanning", transport.isScanning());
        transport.getEndpoint().ifPresent(endpoint -> status.put("endpoint", endpoint));
        ctx.json(ApiResponse.success(status));
    }

    private void getVirtualPrinter(Context ctx) {
        ctx.json(ApiResponse.success(discoverySession.getVirtualPrinter()));
    }

    /**
     * Current printer selection DTO
     */
    public static class PrinterSelection {
        private String id;

        public String getId() {
            return id;
        }
        public void setId(String id) {
            this.id = id;
        }
    }
}
