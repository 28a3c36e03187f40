package rawt.dal;

/**
 * Posted on the event bus when a current printer is selected
 * @since 19/10/2026
 */
public record PrinterConfiguredEvent(SavedPrinter printer) {
}
