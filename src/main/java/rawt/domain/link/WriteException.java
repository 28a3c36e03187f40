package rawt.domain.link;

/**
 * A chunk write failed; the rest of the buffer was not sent
 * @since 19/10/2026
 */
public class WriteException extends LinkException {
    private final int chunkIndex;

    public WriteException(String message, int chunkIndex) {
        super(message);
        this.chunkIndex = chunkIndex;
    }

    public WriteException(String message, int chunkIndex, Throwable cause) {
        super(message, cause);
        this.chunkIndex = chunkIndex;
    }

    /**
     * Index of the failed chunk, -1 if no chunk was attempted
     */
    public int getChunkIndex() {
        return chunkIndex;
    }
}
