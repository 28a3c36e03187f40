package rawt.dal;

import rawt.common.EPaperWidth;

import java.util.Optional;

/**
 * Immutable view of the printer selection and settings, taken once per job
 * @since 19/10/2026
 */
public record PrintSettingsSnapshot(SavedPrinter currentPrinter, AppSettings settings) {

    public Optional<SavedPrinter> printer() {
        return Optional.ofNullable(currentPrinter);
    }

    public boolean hasPrinter() {
        return currentPrinter != null;
    }

    /**
     * Paper of the selected printer, or the default width when none is selected
     */
    public EPaperWidth paperWidth() {
        return currentPrinter != null ? currentPrinter.paperWidth() : settings.defaultPaperWidth();
    }
}
