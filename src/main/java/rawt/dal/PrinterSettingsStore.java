package rawt.dal;

import com.google.common.eventbus.EventBus;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Saved printers, the current printer selection and app settings, persisted as one JSON file.
 * Selecting a current printer posts a {@link PrinterConfiguredEvent}.
 * @since 19/10/2026
 */
public class PrinterSettingsStore {
    private static final Logger logger = LoggerFactory.getLogger(PrinterSettingsStore.class);

    private final Path file;
    private final EventBus eventBus;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Object lock = new Object();

    private List<SavedPrinter> printers;
    private String currentPrinterId;
    private AppSettings settings;

    /** On-disk layout */
    private static final class State {
        List<SavedPrinter> printers;
        String currentPrinterId;
        AppSettings settings;
    }

    public PrinterSettingsStore(StoreConfig storeConfig, EventBus eventBus) throws StoreException {
        this.file = storeConfig.settingsFile();
        this.eventBus = eventBus;

        State state = JsonFiles.read(gson, file, State.class);
        if (state == null) {
            this.printers = new ArrayList<>();
            this.settings = AppSettings.defaults();
            logger.info("No printer settings at {}, starting with defaults", file.toAbsolutePath());
        } else {
            this.printers = state.printers == null ? new ArrayList<>() : new ArrayList<>(state.printers);
            this.settings = state.settings == null ? AppSettings.defaults() : state.settings;
            this.currentPrinterId = findPrinter(state.currentPrinterId).map(SavedPrinter::id).orElse(null);
            logger.info("✓ Loaded {} saved printer(s), current: {}", printers.size(), currentPrinterId);
        }
    }

    public List<SavedPrinter> getSavedPrinters() {
        synchronized (lock) {
            return List.copyOf(printers);
        }
    }

    public Optional<SavedPrinter> getPrinter(String id) {
        synchronized (lock) {
            return findPrinter(id);
        }
    }

    /**
     * Add a printer or replace the one with the same id
     */
    public void savePrinter(SavedPrinter printer) throws StoreException {
        boolean replacedCurrent;
        synchronized (lock) {
            List<SavedPrinter> updated = new ArrayList<>(printers);
            updated.removeIf(p -> p.id().equals(printer.id()));
            updated.add(printer);
            persist(updated, currentPrinterId, settings);
            printers = updated;
            replacedCurrent = printer.id().equals(currentPrinterId);
        }
        logger.info("Saved printer {}", printer);
        if (replacedCurrent) {
            eventBus.post(new PrinterConfiguredEvent(printer));
        }
    }

    /**
     * Forget a printer; removing the current printer clears the selection
     */
    public boolean removePrinter(String id) throws StoreException {
        synchronized (lock) {
            if (findPrinter(id).isEmpty()) {
                return false;
            }
            List<SavedPrinter> updated = new ArrayList<>(printers);
            updated.removeIf(p -> p.id().equals(id));
            String newCurrent = id.equals(currentPrinterId) ? null : currentPrinterId;
            persist(updated, newCurrent, settings);
            printers = updated;
            currentPrinterId = newCurrent;
        }
        logger.info("Removed printer {}", id);
        return true;
    }

    public Optional<SavedPrinter> getCurrentPrinter() {
        synchronized (lock) {
            return findPrinter(currentPrinterId);
        }
    }

    /**
     * Select the printer jobs go to. Blocked jobs are replayed by the listener of the posted event.
     * @throws IllegalArgumentException if no saved printer has this id
     */
    public SavedPrinter setCurrentPrinter(String id) throws StoreException {
        SavedPrinter printer;
        synchronized (lock) {
            printer = findPrinter(id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown printer: " + id));
            persist(printers, printer.id(), settings);
            currentPrinterId = printer.id();
        }
        logger.info("Current printer set to {}", printer);
        eventBus.post(new PrinterConfiguredEvent(printer));
        return printer;
    }

    public void clearCurrentPrinter() throws StoreException {
        synchronized (lock) {
            persist(printers, null, settings);
            currentPrinterId = null;
        }
        logger.info("Current printer cleared");
    }

    public AppSettings getAppSettings() {
        synchronized (lock) {
            return settings;
        }
    }

    public void updateAppSettings(AppSettings newSettings) throws StoreException {
        if (newSettings == null) {
            throw new IllegalArgumentException("Settings cannot be null");
        }
        synchronized (lock) {
            persist(printers, currentPrinterId, newSettings);
            settings = newSettings;
        }
        logger.info("App settings updated: {}", newSettings);
    }

    public PrintSettingsSnapshot snapshot() {
        synchronized (lock) {
            return new PrintSettingsSnapshot(findPrinter(currentPrinterId).orElse(null), settings);
        }
    }

    private Optional<SavedPrinter> findPrinter(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return printers.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    private void persist(List<SavedPrinter> newPrinters, String newCurrentId, AppSettings newSettings) throws StoreException {
        State state = new State();
        state.printers = newPrinters;
        state.currentPrinterId = newCurrentId;
        state.settings = newSettings;
        JsonFiles.writeAtomically(gson, file, state);
    }
}
