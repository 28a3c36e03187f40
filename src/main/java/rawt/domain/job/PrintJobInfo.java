package rawt.domain.job;

import rawt.common.EContentType;

/**
 * Read-only job view for the API and events
 * @since 19/10/2026
 */
public record PrintJobInfo(String id, String title, EContentType contentType, EJobStatus status,
                           long createdAt, long startedAt, long finishedAt, String blockedReason,
                           EJobErrorClass errorClass, String errorMessage,
                           int failedPageIndex, int lastPrintedPageIndex,
                           int pagesPrinted, int totalPages) {
}
