package rawt.domain.job;

import rawt.common.EContentType;

import java.nio.file.Path;

/**
 * PDF or image file rendered page by page
 * @since 19/10/2026
 */
public final class DocumentContent implements IPrintContent {
    private final Path file;
    private final String mimeType;
    private final boolean temporary;

    /**
     * @param temporary the file is a spool copy owned by the job and deleted when the job is done with it
     */
    public DocumentContent(Path file, String mimeType, boolean temporary) {
        if (file == null) {
            throw new IllegalArgumentException("Document file cannot be null");
        }
        this.file = file;
        this.mimeType = mimeType;
        this.temporary = temporary;
    }

    public Path getFile() {
        return file;
    }

    public boolean isTemporary() {
        return temporary;
    }

    @Override
    public EContentType getType() {
        return EContentType.DOCUMENT;
    }

    @Override
    public String getMimeType() {
        return mimeType;
    }
}
