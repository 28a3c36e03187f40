package rawt.domain.job;

/**
 * A job is waiting because no printer is configured
 * @since 19/10/2026
 */
public record PrinterSetupRequiredEvent(String jobId, String title, String reason) {
}
