package rawt.domain.link;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.ReplaySubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.common.EPaperWidth;
import rawt.common.LinkConstants;
import rawt.dal.LinkConfig;
import rawt.domain.escpos.CommandBuffer;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Chunked printer link on top of an {@link ILinkDriver}.
 *
 * <p>State machine: DISCONNECTED -> CONNECTING -> CONNECTED, back to DISCONNECTED on
 * {@link #disconnect()} or link loss. Driver calls run on a dedicated I/O thread so that
 * connect and every chunk write are bounded by the configured timeouts. A call that outlives
 * its timeout is aborted by closing the driver from the caller, and the I/O thread is replaced.</p>
 *
 * <p>The negotiated MTU is authoritative. When negotiation is unavailable the transport
 * assumes the minimum MTU instead of guessing a larger one.</p>
 *
 * @since 19/10/2026
 */
public class LinkTransport implements ILinkTransport {
    private static final Logger logger = LoggerFactory.getLogger(LinkTransport.class);
    private static final String DISCONNECT_OPERATION = "Disconnect";

    private final ILinkDriver driver;
    private final LinkConfig config;
    private final Subject<LinkEventArgs> eventBus = PublishSubject.<LinkEventArgs>create().toSerialized();
    private final ReentrantLock connectionLock = new ReentrantLock();
    private final AtomicLong connectionGeneration = new AtomicLong();
    private volatile ExecutorService ioExecutor;

    private volatile ELinkState state = ELinkState.DISCONNECTED;
    private volatile PrinterEndpoint endpoint;
    private volatile WriteTarget writeTarget;
    private volatile boolean scanning;
    private volatile Subject<DiscoveredDevice> scanResults;

    public LinkTransport(ILinkDriver driver, LinkConfig config) {
        this.driver = driver;
        this.config = config;
        this.ioExecutor = newIoExecutor();
        logger.info("✓ Link transport initialized with {} driver", driver.getName());
    }

    @Override
    public PrinterEndpoint connect(String endpointId, EPaperWidth paperWidth) throws ConnectionException {
        if (endpointId == null || endpointId.isBlank()) {
            throw new ConnectionException("Endpoint address is required");
        }

        connectionLock.lock();
        try {
            if (!driver.isEnabled()) {
                throw new ConnectionException("Link is disabled");
            }
            if (state != ELinkState.DISCONNECTED) {
                logger.info("Closing connection to {} before connecting to {}", currentEndpointId(), endpointId);
                teardown("Replaced by new connection");
            }

            long generation = connectionGeneration.incrementAndGet();
            transitionTo(ELinkState.CONNECTING, endpointId, null);

            try {
                callWithTimeout(() -> {
                    driver.open(endpointId, () -> onLinkLost(generation));
                    return null;
                }, config.connectTimeout(), "Connect");

                int mtu = negotiateMtu();
                int payload = Math.max(1, mtu - driver.getHeaderOverhead());

                List<GattService> services = callWithTimeout(driver::discoverServices, config.connectTimeout(), "Service discovery");
                WriteTarget target = ServiceSelector.select(services)
                        .orElseThrow(() -> new ConnectionException("No usable printer interface"));
                if (connectionGeneration.get() != generation) {
                    throw new ConnectionException("Link lost while connecting");
                }

                PrinterEndpoint connected = new PrinterEndpoint(endpointId, paperWidth, mtu, payload,
                        target.service().uuid(), target.characteristic().uuid());
                this.writeTarget = target;
                this.endpoint = connected;
                transitionTo(ELinkState.CONNECTED, endpointId, null);
                logger.info("✓ Connected: {}", connected);
                return connected;

            } catch (ConnectionException e) {
                abortConnect(endpointId, e.getMessage());
                throw e;
            } catch (IOException e) {
                abortConnect(endpointId, e.getMessage());
                throw new ConnectionException("Cannot connect to " + endpointId + ": " + e.getMessage(), e);
            }
        } finally {
            connectionLock.unlock();
        }
    }

    private int negotiateMtu() {
        try {
            OptionalInt negotiated = callWithTimeout(() -> driver.requestMtu(LinkConstants.REQUESTED_MTU),
                    config.connectTimeout(), "MTU negotiation");
            if (negotiated.isPresent() && negotiated.getAsInt() >= LinkConstants.DEFAULT_MTU) {
                logger.debug("Negotiated MTU: {}", negotiated.getAsInt());
                return negotiated.getAsInt();
            }
            logger.info("MTU negotiation unavailable, using minimum MTU {}", LinkConstants.DEFAULT_MTU);
        } catch (IOException e) {
            logger.warn("MTU negotiation failed, using minimum MTU {}: {}", LinkConstants.DEFAULT_MTU, e.getMessage());
        }
        return LinkConstants.DEFAULT_MTU;
    }

    private void abortConnect(String endpointId, String reason) {
        logger.error("Connection to {} failed: {}", endpointId, reason);
        closeDriver();
        endpoint = null;
        writeTarget = null;
        transitionTo(ELinkState.DISCONNECTED, endpointId, reason);
    }

    @Override
    public void write(CommandBuffer buffer) throws LinkException {
        write(buffer, () -> false);
    }

    @Override
    public void write(CommandBuffer buffer, BooleanSupplier abortRequested) throws LinkException {
        PrinterEndpoint target = endpoint;
        WriteTarget characteristic = writeTarget;
        if (state != ELinkState.CONNECTED || target == null || characteristic == null) {
            throw new WriteException("No printer connected", -1);
        }
        long generation = connectionGeneration.get();

        int payload = target.maxChunkPayload();
        int length = buffer.length();
        int chunkCount = (length + payload - 1) / payload;
        logger.debug("Writing {} bytes in {} chunk(s) of at most {} bytes", length, chunkCount, payload);

        for (int index = 0; index < chunkCount; index++) {
            if (abortRequested.getAsBoolean()) {
                throw new WriteCanceledException(index);
            }
            if (connectionGeneration.get() != generation || state != ELinkState.CONNECTED) {
                throw new LinkLostException("Link lost during write", index);
            }

            int from = index * payload;
            byte[] chunk = buffer.copyRange(from, Math.min(length, from + payload));
            final int chunkIndex = index;
            try {
                callWithTimeout(() -> {
                    driver.write(characteristic, chunk);
                    return null;
                }, config.writeTimeout(), "Chunk write");
            } catch (IOException e) {
                if (connectionGeneration.get() != generation || state != ELinkState.CONNECTED) {
                    throw new LinkLostException("Link lost during write: " + e.getMessage(), chunkIndex);
                }
                throw new WriteException("Chunk " + chunkIndex + " of " + chunkCount + " failed: " + e.getMessage(), chunkIndex, e);
            }

            if (index < chunkCount - 1 && config.chunkDelayMs() > 0) {
                pause(config.chunkDelayMs(), index);
            }
        }
    }

    private void pause(int millis, int chunkIndex) throws WriteException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WriteException("Interrupted between chunks", chunkIndex, e);
        }
    }

    @Override
    public void disconnect() {
        connectionLock.lock();
        try {
            if (state == ELinkState.DISCONNECTED) {
                return;
            }
            teardown(null);
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Close the driver and wait for it before reporting DISCONNECTED
     */
    private void teardown(String reason) {
        String endpointId = currentEndpointId();
        connectionGeneration.incrementAndGet();
        closeDriver();
        endpoint = null;
        writeTarget = null;
        transitionTo(ELinkState.DISCONNECTED, endpointId, reason);
        logger.info("Disconnected from {}", endpointId);
    }

    private void closeDriver() {
        try {
            callWithTimeout(() -> {
                driver.close();
                return null;
            }, config.connectTimeout(), DISCONNECT_OPERATION);
        } catch (IOException e) {
            logger.warn("Error closing {} link: {}", driver.getName(), e.getMessage());
        }
    }

    /**
     * Driver callback; stale callbacks from an older connection are ignored
     */
    private void onLinkLost(long generation) {
        if (connectionGeneration.compareAndSet(generation, generation + 1)) {
            String endpointId = currentEndpointId();
            logger.warn("Link to {} lost", endpointId);
            endpoint = null;
            writeTarget = null;
            transitionTo(ELinkState.DISCONNECTED, endpointId, "Link lost");
        }
    }

    @Override
    public boolean isConnected() {
        return state == ELinkState.CONNECTED;
    }

    @Override
    public ELinkState getState() {
        return state;
    }

    @Override
    public Optional<PrinterEndpoint> getEndpoint() {
        return Optional.ofNullable(endpoint);
    }

    /**
     * Start a scan, or join the running one. Devices found so far in this scan are replayed
     * to late subscribers; the stream completes when the scan is stopped.
     */
    @Override
    public synchronized Observable<DiscoveredDevice> startScan() throws LinkException {
        if (!driver.isEnabled()) {
            throw new ConnectionException("Link is disabled");
        }
        if (!scanning) {
            Subject<DiscoveredDevice> results = ReplaySubject.<DiscoveredDevice>create().toSerialized();
            scanResults = results;
            scanning = true;
            try {
                driver.startScan(device -> {
                    results.onNext(device);
                    eventBus.onNext(LinkEventArgs.deviceFound(device));
                });
                logger.info("Scan started on {} link", driver.getName());
            } catch (IOException e) {
                scanning = false;
                scanResults = null;
                throw new LinkException("Cannot start scan: " + e.getMessage(), e);
            }
        }
        return scanResults.distinct(DiscoveredDevice::id);
    }

    @Override
    public synchronized void stopScan() {
        if (scanning) {
            driver.stopScan();
            scanning = false;
            scanResults.onComplete();
            scanResults = null;
            logger.info("Scan stopped");
        }
    }

    @Override
    public boolean isScanning() {
        return scanning;
    }

    @Override
    public Observable<LinkEventArgs> getStateChanges() {
        return eventBus.filter(ea -> ea.getType() == LinkEventArgs.EType.STATE_CHANGED);
    }

    @Override
    public void close() {
        stopScan();
        disconnect();
        ioExecutor.shutdownNow();
        logger.info("Link transport closed");
    }

    private <T> T callWithTimeout(Callable<T> call, long timeoutMs, String operation) throws IOException {
        Future<T> future = ioExecutor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            abandonStuckCall(operation);
            throw new LinkException(operation + " timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LinkException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new LinkException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Socket and serial writes ignore interrupts; closing the driver is what unblocks them.
     * The I/O thread is swapped so later calls do not queue behind the stuck one.
     */
    private void abandonStuckCall(String operation) {
        logger.warn("{} is stuck on the {} link, closing it", operation, driver.getName());
        ExecutorService stuckExecutor = ioExecutor;
        ioExecutor = newIoExecutor();
        stuckExecutor.shutdownNow();
        if (!DISCONNECT_OPERATION.equals(operation)) {
            try {
                driver.close();
            } catch (IOException e) {
                logger.warn("Error closing stuck {} link: {}", driver.getName(), e.getMessage());
            }
        }
    }

    private static ExecutorService newIoExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "link-io");
            thread.setDaemon(true);
            return thread;
        });
    }

    private String currentEndpointId() {
        PrinterEndpoint current = endpoint;
        return current != null ? current.id() : null;
    }

    private void transitionTo(ELinkState newState, String endpointId, String reason) {
        logger.debug("Link state transition: {} -> {}", state, newState);
        this.state = newState;
        eventBus.onNext(LinkEventArgs.stateChanged(newState, endpointId, reason));
    }
}
