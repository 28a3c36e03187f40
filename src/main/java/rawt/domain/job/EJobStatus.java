package rawt.domain.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Print job lifecycle.
 * QUEUED -> PRINTING -> COMPLETED | FAILED | CANCELED, with QUEUED -> BLOCKED -> PRINTING
 * when no printer is configured at submission.
 * @since 19/10/2026
 */
public enum EJobStatus {
    QUEUED,
    BLOCKED,
    PRINTING,
    COMPLETED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    public boolean canTransitionTo(EJobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<EJobStatus> allowedNext() {
        switch (this) {
            case QUEUED:
                return EnumSet.of(BLOCKED, PRINTING, FAILED, CANCELED);
            case BLOCKED:
                return EnumSet.of(PRINTING, FAILED, CANCELED);
            case PRINTING:
                return EnumSet.of(COMPLETED, FAILED, CANCELED);
            default:
                return EnumSet.noneOf(EJobStatus.class);
        }
    }
}
