package rawt.domain.link;

import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * Physical link to a printer (serial port, TCP socket, simulated).
 * Calls may block; the transport bounds them with timeouts and never calls them concurrently,
 * except {@link #close()}, which may come from another thread to abort a stuck call.
 * @since 19/10/2026
 */
public interface ILinkDriver {
    String getName();

    /**
     * Link hardware available and switched on
     */
    boolean isEnabled();

    /**
     * Open the link to the given address
     * @param onLinkLost called from any thread if the link drops after opening
     */
    void open(String address, Runnable onLinkLost) throws IOException;

    /**
     * Ask for a larger MTU
     * @return the negotiated MTU, or empty when the link offers no negotiation
     */
    OptionalInt requestMtu(int mtu) throws IOException;

    /**
     * Bytes of each MTU taken by protocol headers
     */
    int getHeaderOverhead();

    List<GattService> discoverServices() throws IOException;

    void write(WriteTarget target, byte[] chunk) throws IOException;

    void close() throws IOException;

    void startScan(Consumer<DiscoveredDevice> onDeviceFound) throws IOException;

    void stopScan();
}
