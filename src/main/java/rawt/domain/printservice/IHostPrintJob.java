package rawt.domain.printservice;

import java.io.IOException;
import java.io.InputStream;

/**
 * A job handed to the virtual printer by the host print subsystem.
 * The state calls report progress back to the host.
 * @since 19/10/2026
 */
public interface IHostPrintJob {
    String getId();

    String getTitle();

    /**
     * @return document mime type, {@code application/pdf} when the host does not say
     */
    String getMimeType();

    /**
     * @return the document bytes, or null when the host has no document data
     */
    InputStream openDocument() throws IOException;

    void start();

    void block(String reason);

    void complete();

    void fail(String reason);

    void cancel();
}
