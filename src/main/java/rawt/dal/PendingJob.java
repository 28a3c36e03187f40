package rawt.dal;

import rawt.common.EContentType;

/**
 * A job waiting for a printer. The content has already been copied into the job store,
 * {@code contentFile} is relative to the store's content directory.
 * @since 19/10/2026
 */
public record PendingJob(String id, String title, EContentType contentType, String mimeType,
                         String contentFile, long createdAt, long sequence) {

    @Override
    public String toString() {
        return String.format("PendingJob{id='%s', title='%s', type=%s, created=%d}", id, title, contentType, createdAt);
    }
}
