package rawt.domain.printservice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.domain.job.IPrintJobListener;
import rawt.domain.job.JobFailure;
import rawt.domain.job.PrintJob;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mirrors orchestrator callbacks onto the host job. Each host call happens at most once;
 * only the first terminal outcome is reported.
 * @since 19/10/2026
 */
class HostJobListener implements IPrintJobListener {
    private static final Logger logger = LoggerFactory.getLogger(HostJobListener.class);

    private final IHostPrintJob hostJob;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean blocked = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();

    HostJobListener(IHostPrintJob hostJob) {
        this.hostJob = hostJob;
    }

    @Override
    public void onStarted(PrintJob job) {
        if (started.compareAndSet(false, true)) {
            hostJob.start();
        }
    }

    @Override
    public void onBlocked(PrintJob job, String reason) {
        if (blocked.compareAndSet(false, true)) {
            hostJob.block(reason);
        }
    }

    @Override
    public void onCompleted(PrintJob job) {
        if (finished.compareAndSet(false, true)) {
            logger.debug("Host job {} completed", hostJob.getId());
            hostJob.complete();
        }
    }

    @Override
    public void onFailed(PrintJob job, JobFailure failure) {
        if (finished.compareAndSet(false, true)) {
            logger.debug("Host job {} failed: {}", hostJob.getId(), failure);
            hostJob.fail(failure.toString());
        }
    }

    @Override
    public void onCanceled(PrintJob job) {
        if (finished.compareAndSet(false, true)) {
            logger.debug("Host job {} canceled", hostJob.getId());
            hostJob.cancel();
        }
    }

    /**
     * Fail the host job directly when it never reached the orchestrator
     */
    void failBeforeSubmit(String reason) {
        if (finished.compareAndSet(false, true)) {
            hostJob.fail(reason);
        }
    }
}
