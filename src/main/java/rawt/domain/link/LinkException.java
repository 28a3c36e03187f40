package rawt.domain.link;

import java.io.IOException;

/**
 * Base class for printer link failures
 * @since 19/10/2026
 */
public class LinkException extends IOException {
    public LinkException(String message) {
        super(message);
    }

    public LinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
