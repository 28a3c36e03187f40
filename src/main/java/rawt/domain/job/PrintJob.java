package rawt.domain.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One print request and its lifecycle state. Only the orchestrator changes the state.
 * @since 19/10/2026
 */
public class PrintJob {
    private static final Logger logger = LoggerFactory.getLogger(PrintJob.class);

    private final String id;
    private final String title;
    private final IPrintContent content;
    private final IPrintJobListener listener;
    private final long createdAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CompletableFuture<PrintJob> completion = new CompletableFuture<>();

    private EJobStatus status = EJobStatus.QUEUED;
    private long startedAt;
    private long finishedAt;
    private String blockedReason;
    private JobFailure failure;
    private int pagesPrinted;
    private int totalPages;

    public PrintJob(String id, String title, IPrintContent content, IPrintJobListener listener) {
        this.id = id;
        this.title = title == null || title.isBlank() ? "Print job" : title;
        this.content = content;
        this.listener = listener;
        this.createdAt = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public IPrintContent getContent() {
        return content;
    }

    IPrintJobListener getListener() {
        return listener;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public synchronized EJobStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized String getBlockedReason() {
        return blockedReason;
    }

    public synchronized JobFailure getFailure() {
        return failure;
    }

    public synchronized int getPagesPrinted() {
        return pagesPrinted;
    }

    public synchronized int getTotalPages() {
        return totalPages;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Completes with this job once it reaches a terminal status
     */
    public CompletableFuture<PrintJob> completion() {
        return completion;
    }

    void requestCancel() {
        cancelRequested.set(true);
    }

    synchronized void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }

    synchronized void pagePrinted() {
        pagesPrinted++;
    }

    /**
     * Move to {@code next}.
     * @return false if the job already reached a terminal status (lost a race with cancel)
     * @throws IllegalStateException for any other transition the lifecycle does not allow
     */
    synchronized boolean tryTransition(EJobStatus next) {
        if (status.isTerminal()) {
            return false;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal job transition " + status + " -> " + next + " for job " + id);
        }
        logger.debug("Job {} transition: {} -> {}", id, status, next);
        status = next;
        long now = System.currentTimeMillis();
        if (next == EJobStatus.PRINTING) {
            startedAt = now;
            blockedReason = null;
        } else if (next.isTerminal()) {
            finishedAt = now;
        }
        return true;
    }

    synchronized boolean block(String reason) {
        if (!tryTransition(EJobStatus.BLOCKED)) {
            return false;
        }
        blockedReason = reason;
        return true;
    }

    /**
     * Cancel only if the job has not started printing yet
     */
    synchronized boolean cancelIfWaiting() {
        if (status != EJobStatus.QUEUED && status != EJobStatus.BLOCKED) {
            return false;
        }
        return tryTransition(EJobStatus.CANCELED);
    }

    synchronized boolean fail(JobFailure jobFailure) {
        if (!tryTransition(EJobStatus.FAILED)) {
            return false;
        }
        failure = jobFailure;
        return true;
    }

    /**
     * Release waiters; called after listeners were notified
     */
    void completeFuture() {
        completion.complete(this);
    }

    public synchronized PrintJobInfo toInfo() {
        return new PrintJobInfo(id, title, content.getType(), status, createdAt, startedAt, finishedAt, blockedReason,
                failure != null ? failure.errorClass() : null,
                failure != null ? failure.message() : null,
                failure != null ? failure.failedPageIndex() : -1,
                failure != null ? failure.lastPrintedPageIndex() : pagesPrinted - 1,
                pagesPrinted, totalPages);
    }

    @Override
    public synchronized String toString() {
        return String.format("PrintJob{id='%s', title='%s', type=%s, status=%s}", id, title, content.getType(), status);
    }
}
