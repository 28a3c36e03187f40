package rawt.dal;

/**
 * Durable storage could not be read or written
 * @since 19/10/2026
 */
public class StoreException extends Exception {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
