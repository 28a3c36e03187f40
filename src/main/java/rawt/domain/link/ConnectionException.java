package rawt.domain.link;

/**
 * The endpoint could not be reached or offers no usable printer interface.
 * The transport is left disconnected.
 * @since 19/10/2026
 */
public class ConnectionException extends LinkException {
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
