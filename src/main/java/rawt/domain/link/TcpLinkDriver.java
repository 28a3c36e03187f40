package rawt.domain.link;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.LinkConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * Raw TCP link to a network printer, address {@code host} or {@code host:port}
 * @since 19/10/2026
 */
public class TcpLinkDriver implements ILinkDriver {
    private static final Logger logger = LoggerFactory.getLogger(TcpLinkDriver.class);
    static final String RAW_SERVICE = "raw-tcp";

    private final LinkConfig config;
    private Socket socket;
    private OutputStream outputStream;

    public TcpLinkDriver(LinkConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "NETWORK";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void open(String address, Runnable onLinkLost) throws IOException {
        InetSocketAddress socketAddress = parseAddress(address, config.networkPort());
        logger.info("Connecting to network printer: {}", socketAddress);

        Socket newSocket = new Socket();
        try {
            newSocket.connect(socketAddress, config.connectTimeout());
            newSocket.setKeepAlive(true);
            newSocket.setTcpNoDelay(true);
            newSocket.setSoTimeout(config.writeTimeout());
        } catch (IOException e) {
            newSocket.close();
            throw e;
        }
        this.socket = newSocket;
        this.outputStream = newSocket.getOutputStream();
    }

    static InetSocketAddress parseAddress(String address, int defaultPort) {
        int colon = address.lastIndexOf(':');
        if (colon > 0 && colon < address.length() - 1) {
            try {
                int port = Integer.parseInt(address.substring(colon + 1));
                return new InetSocketAddress(address.substring(0, colon), port);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in address: " + address, e);
            }
        }
        return new InetSocketAddress(address, defaultPort);
    }

    @Override
    public OptionalInt requestMtu(int mtu) {
        return OptionalInt.of(config.networkChunkSize());
    }

    @Override
    public int getHeaderOverhead() {
        return 0;
    }

    @Override
    public List<GattService> discoverServices() {
        return List.of(new GattService(RAW_SERVICE, List.of(GattCharacteristic.writable(RAW_SERVICE))));
    }

    @Override
    public void write(WriteTarget target, byte[] chunk) throws IOException {
        if (outputStream == null) {
            throw new IOException("Socket is not connected");
        }
        outputStream.write(chunk);
        outputStream.flush();
    }

    @Override
    public void close() throws IOException {
        Socket current = socket;
        socket = null;
        outputStream = null;
        if (current != null) {
            current.close();
            logger.debug("Socket closed");
        }
    }

    @Override
    public void startScan(Consumer<DiscoveredDevice> onDeviceFound) throws IOException {
        throw new IOException("Scanning is not supported on network links");
    }

    @Override
    public void stopScan() {
        logger.debug("Network links do not scan");
    }
}
