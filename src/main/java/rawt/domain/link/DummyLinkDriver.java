package rawt.domain.link;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.common.LinkConstants;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Dummy link - used when no physical printer is available.
 * Behaves like a low energy link: negotiable MTU, 3 byte header, standard printer service.
 * Every chunk is logged and kept so the stream can be inspected.
 * @since 19/10/2026
 */
public class DummyLinkDriver implements ILinkDriver {
    private static final Logger logger = LoggerFactory.getLogger(DummyLinkDriver.class);

    private final List<byte[]> writtenChunks = new CopyOnWriteArrayList<>();
    private final AtomicInteger openCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();

    private volatile List<GattService> services = List.of(new GattService(LinkConstants.PRINTER_SERVICE_UUID,
            List.of(GattCharacteristic.writable(LinkConstants.PRINTER_CHARACTERISTIC_UUID))));
    private volatile List<DiscoveredDevice> scanDevices = List.of(
            new DiscoveredDevice("DUMMY-00:11:22:33:44:55", "Dummy Thermal Printer", -50,
                    List.of(LinkConstants.PRINTER_SERVICE_UUID)));
    private volatile OptionalInt negotiatedMtu;
    private volatile boolean enabled = true;
    private volatile boolean failOpen;
    private volatile int failAfterChunks = -1;
    private volatile long writeDelayMs;

    private volatile boolean open;
    private volatile String address;
    private volatile Runnable onLinkLost;

    public DummyLinkDriver() {
        this(185);
    }

    public DummyLinkDriver(int mtu) {
        this.negotiatedMtu = OptionalInt.of(mtu);
    }

    @Override
    public String getName() {
        return "DUMMY";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void open(String address, Runnable onLinkLost) throws IOException {
        openCount.incrementAndGet();
        if (failOpen) {
            throw new IOException("Dummy endpoint unreachable: " + address);
        }
        this.address = address;
        this.onLinkLost = onLinkLost;
        this.open = true;
        logger.info("DummyLinkDriver connected to {} (no physical hardware)", address);
    }

    @Override
    public OptionalInt requestMtu(int mtu) {
        OptionalInt current = negotiatedMtu;
        return current.isPresent() ? OptionalInt.of(Math.min(mtu, current.getAsInt())) : OptionalInt.empty();
    }

    @Override
    public int getHeaderOverhead() {
        return LinkConstants.ATT_HEADER_SIZE;
    }

    @Override
    public List<GattService> discoverServices() {
        return services;
    }

    @Override
    public void write(WriteTarget target, byte[] chunk) throws IOException {
        if (!open) {
            throw new IOException("Dummy link is not open");
        }
        if (failAfterChunks >= 0 && writtenChunks.size() >= failAfterChunks) {
            throw new IOException("Simulated write failure");
        }
        if (writeDelayMs > 0) {
            try {
                Thread.sleep(writeDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Write interrupted", e);
            }
        }
        writtenChunks.add(chunk.clone());
        logger.trace("DummyLinkDriver.write: {} bytes to {}", chunk.length, target);
    }

    @Override
    public void close() {
        if (open) {
            closeCount.incrementAndGet();
        }
        open = false;
        onLinkLost = null;
        logger.info("DummyLinkDriver disconnected");
    }

    @Override
    public void startScan(Consumer<DiscoveredDevice> onDeviceFound) {
        logger.debug("DummyLinkDriver.startScan");
        for (DiscoveredDevice device : scanDevices) {
            onDeviceFound.accept(device);
        }
    }

    @Override
    public void stopScan() {
        logger.debug("DummyLinkDriver.stopScan");
    }

    /**
     * Drop the link as a powered off printer would
     */
    public void simulateLinkLoss() {
        Runnable callback = onLinkLost;
        open = false;
        if (callback != null) {
            callback.run();
        }
    }

    public void setServices(List<GattService> services) {
        this.services = List.copyOf(services);
    }

    public void setScanDevices(List<DiscoveredDevice> devices) {
        this.scanDevices = List.copyOf(devices);
    }

    /**
     * MTU granted on request, empty to simulate a link without negotiation
     */
    public void setNegotiatedMtu(OptionalInt mtu) {
        this.negotiatedMtu = mtu;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setFailOpen(boolean failOpen) {
        this.failOpen = failOpen;
    }

    /**
     * Fail every write once this many chunks have been accepted, -1 to never fail
     */
    public void setFailAfterChunks(int chunks) {
        this.failAfterChunks = chunks;
    }

    public void setWriteDelayMs(long writeDelayMs) {
        this.writeDelayMs = writeDelayMs;
    }

    public List<byte[]> getWrittenChunks() {
        return new ArrayList<>(writtenChunks);
    }

    public byte[] getWrittenBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] chunk : writtenChunks) {
            out.write(chunk, 0, chunk.length);
        }
        return out.toByteArray();
    }

    public void clearWrites() {
        writtenChunks.clear();
    }

    public boolean isOpen() {
        return open;
    }

    public String getAddress() {
        return address;
    }

    public int getOpenCount() {
        return openCount.get();
    }

    public int getCloseCount() {
        return closeCount.get();
    }
}
