package rawt.dal;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rawt.common.ELinkType;
import rawt.common.EPaperWidth;
import rawt.domain.escpos.EPrintDensity;
import rawt.domain.escpos.ETextEncoding;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PrinterSettingsStore
 * @since 19/10/2026
 */
class PrinterSettingsStoreTest {

    @TempDir
    Path tempDir;

    private StoreConfig storeConfig;
    private EventBus eventBus;
    private final List<PrinterConfiguredEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        storeConfig = new StoreConfig(tempDir);
        eventBus = new EventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void onConfigured(PrinterConfiguredEvent event) {
                events.add(event);
            }
        });
    }

    private static SavedPrinter printer(String id) {
        return new SavedPrinter(id, "Printer " + id, ELinkType.SERIAL, "/dev/rfcomm" + id, EPaperWidth.MM_80);
    }

    @Test
    @DisplayName("Should start with defaults and no printer")
    void shouldStartWithDefaults() throws StoreException {
        // When
        PrinterSettingsStore store = new PrinterSettingsStore(storeConfig, eventBus);

        // Then
        assertThat(store.getSavedPrinters()).isEmpty();
        assertThat(store.getCurrentPrinter()).isEmpty();
        assertThat(store.getAppSettings()).isEqualTo(AppSettings.defaults());
        assertThat(store.snapshot().hasPrinter()).isFalse();
        assertThat(store.snapshot().paperWidth()).isEqualTo(EPaperWidth.MM_58);
    }

    @Test
    @DisplayName("Should post event when current printer is selected")
    void shouldPostEventOnSelection() throws StoreException {
        // Given
        PrinterSettingsStore store = new PrinterSettingsStore(storeConfig, eventBus);
        store.savePrinter(printer("1"));
        assertThat(events).isEmpty();

        // When
        store.setCurrentPrinter("1");

        // Then
        assertThat(events).hasSize(1);
        assertThat(events.get(0).printer().id()).isEqualTo("1");
        assertThat(store.snapshot().paperWidth()).isEqualTo(EPaperWidth.MM_80);
    }

    @Test
    @DisplayName("Should reject unknown printer selection")
    void shouldRejectUnknownPrinter() throws StoreException {
        // Given
        PrinterSettingsStore store = new PrinterSettingsStore(storeConfig, eventBus);

        // When & Then
        assertThatThrownBy(() -> store.setCurrentPrinter("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("Should persist printers, selection and settings")
    void shouldPersistAcrossInstances() throws StoreException {
        // Given
        PrinterSettingsStore store = new PrinterSettingsStore(storeConfig, eventBus);
        store.savePrinter(printer("1"));
        store.savePrinter(printer("2"));
        store.setCurrentPrinter("2");
        AppSettings settings = new AppSettings(EPaperWidth.MM_80, false, 5, ETextEncoding.CP437, EPrintDensity.DARK);
        store.updateAppSettings(settings);

        // When
        PrinterSettingsStore reloaded = new PrinterSettingsStore(storeConfig, new EventBus());

        // Then
        assertThat(reloaded.getSavedPrinters()).extracting(SavedPrinter::id).containsExactly("1", "2");
        assertThat(reloaded.getCurrentPrinter()).get().extracting(SavedPrinter::id).isEqualTo("2");
        assertThat(reloaded.getAppSettings()).isEqualTo(settings);
    }

    @Test
    @DisplayName("Should clear selection when current printer is removed")
    void shouldClearSelectionOnRemove() throws StoreException {
        // Given
        PrinterSettingsStore store = new PrinterSettingsStore(storeConfig, eventBus);
        store.savePrinter(printer("1"));
        store.setCurrentPrinter("1");

        // When
        boolean removed = store.removePrinter("1");

        // Then
        assertThat(removed).isTrue();
        assertThat(store.getCurrentPrinter()).isEmpty();
        assertThat(store.removePrinter("1")).isFalse();
    }

    @Test
    @DisplayName("Should repost event when the current printer is edited")
    void shouldRepostWhenCurrentPrinterEdited() throws StoreException {
        // Given
        PrinterSettingsStore store = new PrinterSettingsStore(storeConfig, eventBus);
        store.savePrinter(printer("1"));
        store.setCurrentPrinter("1");

        // When
        store.savePrinter(new SavedPrinter("1", "Renamed", ELinkType.SERIAL, "/dev/rfcomm9", EPaperWidth.MM_58));

        // Then
        assertThat(events).hasSize(2);
        assertThat(store.getCurrentPrinter()).get().extracting(SavedPrinter::address).isEqualTo("/dev/rfcomm9");
    }

    @Test
    @DisplayName("Should reject out of range feed lines")
    void shouldRejectInvalidFeedLines() {
        assertThatThrownBy(() -> new AppSettings(EPaperWidth.MM_58, true, 300, ETextEncoding.UTF_8, EPrintDensity.NORMAL))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
