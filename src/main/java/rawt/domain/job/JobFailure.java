package rawt.domain.job;

/**
 * Why a job failed and how far it got.
 * Page indexes are zero based; -1 means no page was reached or printed.
 * @since 19/10/2026
 */
public record JobFailure(EJobErrorClass errorClass, String message, int failedPageIndex, int lastPrintedPageIndex) {

    public static JobFailure beforePrinting(EJobErrorClass errorClass, String message) {
        return new JobFailure(errorClass, message, -1, -1);
    }

    public static JobFailure atPage(EJobErrorClass errorClass, String message, int failedPageIndex) {
        return new JobFailure(errorClass, message, failedPageIndex, failedPageIndex - 1);
    }

    /**
     * Failure of a job that was writing; once every page is out only the trailing feed and cut
     * can fail, which is reported against the last page.
     */
    public static JobFailure whilePrinting(EJobErrorClass errorClass, String message, int pagesPrinted, int totalPages) {
        if (totalPages > 0 && pagesPrinted >= totalPages) {
            return new JobFailure(errorClass, message, totalPages - 1, totalPages - 1);
        }
        return atPage(errorClass, message, pagesPrinted);
    }

    @Override
    public String toString() {
        if (failedPageIndex < 0) {
            return errorClass + ": " + message;
        }
        return String.format("%s at page %d (last printed page %d): %s",
                errorClass, failedPageIndex, lastPrintedPageIndex, message);
    }
}
