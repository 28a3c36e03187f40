package rawt.domain.link;

import io.reactivex.rxjava3.core.Observable;
import rawt.common.EPaperWidth;
import rawt.domain.escpos.CommandBuffer;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Owns the single printer connection and delivers command buffers in MTU sized chunks
 * @since 19/10/2026
 */
public interface ILinkTransport extends AutoCloseable {

    /**
     * Connect to an endpoint, tearing down any existing connection first
     */
    PrinterEndpoint connect(String endpointId, EPaperWidth paperWidth) throws ConnectionException;

    void write(CommandBuffer buffer) throws LinkException;

    /**
     * Write, checking {@code abortRequested} between chunks
     * @throws WriteCanceledException when the check returns true
     */
    void write(CommandBuffer buffer, BooleanSupplier abortRequested) throws LinkException;

    void disconnect();

    boolean isConnected();

    ELinkState getState();

    Optional<PrinterEndpoint> getEndpoint();

    Observable<DiscoveredDevice> startScan() throws LinkException;

    void stopScan();

    boolean isScanning();

    Observable<LinkEventArgs> getStateChanges();

    @Override
    void close();
}
