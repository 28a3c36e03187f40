package rawt.domain.job;

/**
 * Posted on the event bus at every job status change
 * @since 19/10/2026
 */
public class PrintJobEvent {
    private final PrintJobInfo job;
    private final String source;
    private final long timestamp;

    public PrintJobEvent(PrintJobInfo job, String source) {
        this.job = job;
        this.source = source;
        this.timestamp = System.currentTimeMillis();
    }

    public PrintJobInfo getJob() {
        return job;
    }

    public String getSource() {
        return source;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "PrintJobEvent [job=" + job.id() + ", status=" + job.status() + ", source=" + source + "]";
    }
}
