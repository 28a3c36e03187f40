package rawt.domain.link;

/**
 * The connection dropped while connected
 * @since 19/10/2026
 */
public class LinkLostException extends WriteException {
    public LinkLostException(String message, int chunkIndex) {
        super(message, chunkIndex);
    }
}
