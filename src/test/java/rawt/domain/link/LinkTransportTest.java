package rawt.domain.link;

import com.google.common.util.concurrent.Uninterruptibles;
import io.reactivex.rxjava3.observers.TestObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rawt.common.ELinkType;
import rawt.common.EPaperWidth;
import rawt.dal.LinkConfig;
import rawt.domain.escpos.CommandBuffer;

import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for LinkTransport against the simulated driver
 * @since 19/10/2026
 */
class LinkTransportTest {

    private static final String ADDRESS = "DUMMY-00:11:22:33:44:55";

    private DummyLinkDriver driver;
    private LinkTransport transport;

    @BeforeEach
    void setUp() {
        driver = new DummyLinkDriver(185);
        transport = new LinkTransport(driver, LinkConfig.dummy(185));
    }

    @AfterEach
    void tearDown() {
        transport.close();
    }

    private static CommandBuffer payload(int length) {
        byte[] data = new byte[length];
        for (int i = 0; i < length; i++) {
            data[i] = (byte) i;
        }
        return CommandBuffer.of(data);
    }

    @Test
    @DisplayName("Should connect with negotiated MTU minus header overhead")
    void shouldConnect() throws Exception {
        // When
        PrinterEndpoint endpoint = transport.connect(ADDRESS, EPaperWidth.MM_80);

        // Then
        assertThat(endpoint.mtu()).isEqualTo(185);
        assertThat(endpoint.maxChunkPayload()).isEqualTo(182);
        assertThat(endpoint.paperWidth()).isEqualTo(EPaperWidth.MM_80);
        assertThat(transport.isConnected()).isTrue();
        assertThat(transport.getEndpoint()).contains(endpoint);
        assertThat(driver.getAddress()).isEqualTo(ADDRESS);
    }

    @Test
    @DisplayName("Should split writes into ceil(length / payload) chunks in order")
    void shouldChunkWrites() throws Exception {
        // Given
        transport.connect(ADDRESS, EPaperWidth.MM_58);
        CommandBuffer buffer = payload(1000);

        // When
        transport.write(buffer);

        // Then
        List<byte[]> chunks = driver.getWrittenChunks();
        assertThat(chunks).hasSize(6);
        assertThat(chunks.subList(0, 5)).allSatisfy(chunk -> assertThat(chunk).hasSize(182));
        assertThat(chunks.get(5)).hasSize(1000 - 5 * 182);
        assertThat(driver.getWrittenBytes()).isEqualTo(buffer.toByteArray());
    }

    @Test
    @DisplayName("Should fall back to the minimum MTU when negotiation is unavailable")
    void shouldFallBackToMinimumMtu() throws Exception {
        // Given
        driver.setNegotiatedMtu(OptionalInt.empty());

        // When
        PrinterEndpoint endpoint = transport.connect(ADDRESS, EPaperWidth.MM_58);
        transport.write(payload(45));

        // Then
        assertThat(endpoint.mtu()).isEqualTo(23);
        assertThat(endpoint.maxChunkPayload()).isEqualTo(20);
        assertThat(driver.getWrittenChunks()).extracting(chunk -> chunk.length).containsExactly(20, 20, 5);
    }

    @Test
    @DisplayName("Should write nothing for an empty buffer")
    void shouldWriteNothingForEmptyBuffer() throws Exception {
        transport.connect(ADDRESS, EPaperWidth.MM_58);

        transport.write(CommandBuffer.empty());

        assertThat(driver.getWrittenChunks()).isEmpty();
    }

    @Test
    @DisplayName("Should fail to connect when no printer interface is offered")
    void shouldFailWithoutInterface() {
        // Given
        driver.setServices(List.of(new GattService("0000180f-0000-1000-8000-00805f9b34fb",
                List.of(GattCharacteristic.readOnly("00002a19-0000-1000-8000-00805f9b34fb")))));

        // When / Then
        assertThatThrownBy(() -> transport.connect(ADDRESS, EPaperWidth.MM_58))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("No usable printer interface");
        assertThat(transport.getState()).isEqualTo(ELinkState.DISCONNECTED);
        assertThat(transport.getEndpoint()).isEmpty();
        assertThat(driver.isOpen()).isFalse();
    }

    @Test
    @DisplayName("Should report unreachable endpoints as connection failures")
    void shouldFailWhenUnreachable() {
        driver.setFailOpen(true);

        assertThatThrownBy(() -> transport.connect(ADDRESS, EPaperWidth.MM_58))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("unreachable");
        assertThat(transport.getState()).isEqualTo(ELinkState.DISCONNECTED);
    }

    @Test
    @DisplayName("Should refuse to connect when the link is disabled")
    void shouldRefuseWhenDisabled() {
        driver.setEnabled(false);

        assertThatThrownBy(() -> transport.connect(ADDRESS, EPaperWidth.MM_58))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("disabled");
        assertThat(driver.getOpenCount()).isZero();
    }

    @Test
    @DisplayName("Should tear down the current connection before connecting elsewhere")
    void shouldReplaceConnection() throws Exception {
        // Given
        transport.connect(ADDRESS, EPaperWidth.MM_58);
        TestObserver<LinkEventArgs> states = transport.getStateChanges().test();

        // When
        transport.connect("DUMMY-66:77", EPaperWidth.MM_58);

        // Then
        assertThat(driver.getCloseCount()).isEqualTo(1);
        assertThat(driver.getOpenCount()).isEqualTo(2);
        assertThat(transport.getEndpoint()).map(PrinterEndpoint::id).contains("DUMMY-66:77");
        assertThat(states.values()).extracting(LinkEventArgs::getState)
                .containsExactly(ELinkState.DISCONNECTED, ELinkState.CONNECTING, ELinkState.CONNECTED);
    }

    @Test
    @DisplayName("Should stop at the failing chunk and report its index")
    void shouldReportFailingChunk() throws Exception {
        // Given
        transport.connect(ADDRESS, EPaperWidth.MM_58);
        driver.setFailAfterChunks(2);

        // When / Then
        assertThatThrownBy(() -> transport.write(payload(600)))
                .isInstanceOf(WriteException.class)
                .isNotInstanceOf(LinkLostException.class)
                .satisfies(e -> assertThat(((WriteException) e).getChunkIndex()).isEqualTo(2));
        assertThat(driver.getWrittenChunks()).hasSize(2);
    }

    @Test
    @DisplayName("Should report link loss during a write and drop to disconnected")
    void shouldDetectLinkLossDuringWrite() throws Exception {
        // Given
        transport.connect(ADDRESS, EPaperWidth.MM_58);
        AtomicInteger checks = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> transport.write(payload(600), () -> {
            if (checks.incrementAndGet() == 3) {
                driver.simulateLinkLoss();
            }
            return false;
        }))
                .isInstanceOf(LinkLostException.class)
                .satisfies(e -> assertThat(((LinkLostException) e).getChunkIndex()).isEqualTo(2));
        assertThat(transport.getState()).isEqualTo(ELinkState.DISCONNECTED);
        assertThat(transport.getEndpoint()).isEmpty();
    }

    @Test
    @DisplayName("Should reject writes while disconnected")
    void shouldRejectWriteWhileDisconnected() throws Exception {
        // Given
        transport.connect(ADDRESS, EPaperWidth.MM_58);
        driver.simulateLinkLoss();

        // When / Then
        assertThatThrownBy(() -> transport.write(payload(10)))
                .isInstanceOf(WriteException.class)
                .hasMessageContaining("No printer connected");
    }

    @Test
    @DisplayName("Should stop between chunks when cancel is requested")
    void shouldCancelBetweenChunks() throws Exception {
        // Given
        transport.connect(ADDRESS, EPaperWidth.MM_58);
        AtomicInteger checks = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> transport.write(payload(600), () -> checks.incrementAndGet() > 2))
                .isInstanceOf(WriteCanceledException.class)
                .satisfies(e -> assertThat(((WriteCanceledException) e).getChunksWritten()).isEqualTo(2));
        assertThat(driver.getWrittenChunks()).hasSize(2);
        assertThat(transport.isConnected()).isTrue();
    }

    @Test
    @DisplayName("Should disconnect idempotently")
    void shouldDisconnect() throws Exception {
        transport.connect(ADDRESS, EPaperWidth.MM_58);

        transport.disconnect();
        transport.disconnect();

        assertThat(transport.getState()).isEqualTo(ELinkState.DISCONNECTED);
        assertThat(driver.getCloseCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should replay devices found so far to every subscriber of a scan")
    void shouldReplayScanResults() throws Exception {
        // Given
        DiscoveredDevice printer = new DiscoveredDevice("AA", "POS-58", -55, null);
        DiscoveredDevice speaker = new DiscoveredDevice("BB", "Speaker", -70, null);
        driver.setScanDevices(List.of(printer, speaker, printer));

        // When
        TestObserver<DiscoveredDevice> first = transport.startScan().test();
        TestObserver<DiscoveredDevice> late = transport.startScan().test();
        transport.stopScan();

        // Then
        first.assertValues(printer, speaker).assertComplete();
        late.assertValues(printer, speaker).assertComplete();
        assertThat(transport.isScanning()).isFalse();
    }

    @Test
    @DisplayName("Should refuse to scan when the link is disabled")
    void shouldRefuseScanWhenDisabled() {
        driver.setEnabled(false);

        assertThatThrownBy(() -> transport.startScan()).isInstanceOf(ConnectionException.class);
        assertThat(transport.isScanning()).isFalse();
    }

    private static LinkConfig timedConfig(int connectTimeout, int writeTimeout, int chunkDelayMs) {
        return new LinkConfig(ELinkType.NONE, connectTimeout, writeTimeout, chunkDelayMs, 0, 0, 9100, 0, 185);
    }

    /**
     * Write blocks like a socket whose peer stopped reading: interrupts are ignored, only close releases it
     */
    private static class SocketLikeDriver extends DummyLinkDriver {
        private final CountDownLatch closed = new CountDownLatch(1);
        private volatile boolean blockWrites = true;

        @Override
        public void write(WriteTarget target, byte[] chunk) throws IOException {
            if (blockWrites) {
                Uninterruptibles.awaitUninterruptibly(closed);
                throw new IOException("Socket closed");
            }
            super.write(target, chunk);
        }

        @Override
        public void close() {
            closed.countDown();
            super.close();
        }
    }

    @Test
    @DisplayName("Should close a stuck driver on write timeout and connect again afterwards")
    void shouldRecoverFromStuckWrite() throws Exception {
        // Given
        SocketLikeDriver stuckDriver = new SocketLikeDriver();
        LinkTransport stuckTransport = new LinkTransport(stuckDriver, timedConfig(500, 300, 0));
        try {
            stuckTransport.connect(ADDRESS, EPaperWidth.MM_58);

            // When
            assertThatThrownBy(() -> stuckTransport.write(payload(10)))
                    .isInstanceOf(WriteException.class)
                    .hasMessageContaining("timed out");
            stuckTransport.disconnect();

            // Then
            assertThat(stuckDriver.closed.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(stuckDriver.isOpen()).isFalse();
            assertThat(stuckTransport.getState()).isEqualTo(ELinkState.DISCONNECTED);

            stuckDriver.blockWrites = false;
            stuckTransport.connect(ADDRESS, EPaperWidth.MM_58);
            stuckTransport.write(payload(10));
            assertThat(stuckDriver.getWrittenBytes()).isEqualTo(payload(10).toByteArray());
        } finally {
            stuckTransport.close();
        }
    }

    @Test
    @DisplayName("Should fail a chunk write that exceeds the write timeout")
    void shouldTimeOutSlowWrite() throws Exception {
        // Given
        LinkTransport slowTransport = new LinkTransport(driver, timedConfig(1000, 200, 0));
        try {
            slowTransport.connect(ADDRESS, EPaperWidth.MM_58);
            driver.setWriteDelayMs(2000);

            // When / Then
            assertThatThrownBy(() -> slowTransport.write(payload(10)))
                    .isInstanceOf(WriteException.class)
                    .hasMessageContaining("Chunk write timed out")
                    .satisfies(e -> assertThat(((WriteException) e).getChunkIndex()).isZero());
        } finally {
            slowTransport.close();
        }
    }

    @Test
    @DisplayName("Should fail a connect that exceeds the connect timeout and stay disconnected")
    void shouldTimeOutSlowConnect() {
        // Given
        DummyLinkDriver slowDriver = new DummyLinkDriver(185) {
            @Override
            public void open(String address, Runnable onLinkLost) throws IOException {
                Uninterruptibles.sleepUninterruptibly(1, TimeUnit.SECONDS);
                super.open(address, onLinkLost);
            }
        };
        LinkTransport slowTransport = new LinkTransport(slowDriver, timedConfig(200, 1000, 0));
        try {
            // When / Then
            assertThatThrownBy(() -> slowTransport.connect(ADDRESS, EPaperWidth.MM_58))
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageContaining("Connect timed out");
            assertThat(slowTransport.getState()).isEqualTo(ELinkState.DISCONNECTED);
            assertThat(slowTransport.isConnected()).isFalse();
        } finally {
            slowTransport.close();
        }
    }

    @Test
    @DisplayName("Should pace chunks with the configured delay between them but not after the last")
    void shouldPaceBetweenChunksOnly() throws Exception {
        // Given
        LinkTransport pacedTransport = new LinkTransport(driver, timedConfig(1000, 1000, 200));
        try {
            pacedTransport.connect(ADDRESS, EPaperWidth.MM_58);

            // When
            long started = System.nanoTime();
            pacedTransport.write(payload(500));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            // Then
            assertThat(driver.getWrittenChunks()).hasSize(3);
            assertThat(elapsedMs).isGreaterThanOrEqualTo(400).isLessThan(600);
        } finally {
            pacedTransport.close();
        }
    }
}
