package rawt.domain.job;

/**
 * Job progress callbacks. Each job gets exactly one of
 * onCompleted / onFailed / onCanceled; onBlocked and onStarted at most once each.
 * Called from the submitting thread or the print worker.
 * @since 19/10/2026
 */
public interface IPrintJobListener {
    default void onStarted(PrintJob job) {
    }

    default void onBlocked(PrintJob job, String reason) {
    }

    void onCompleted(PrintJob job);

    void onFailed(PrintJob job, JobFailure failure);

    void onCanceled(PrintJob job);
}
