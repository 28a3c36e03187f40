package rawt.domain.link;

import com.fazecast.jSerialComm.SerialPort;
import com.fazecast.jSerialComm.SerialPortDataListener;
import com.fazecast.jSerialComm.SerialPortEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.common.LinkConstants;
import rawt.dal.LinkConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * Serial port link (Bluetooth SPP bound to a COM/rfcomm port, or USB).
 * A serial port has no service table, so it reports a single SPP service.
 * @since 19/10/2026
 */
public class SerialLinkDriver implements ILinkDriver {
    private static final Logger logger = LoggerFactory.getLogger(SerialLinkDriver.class);

    private final LinkConfig config;
    private SerialPort serialPort;
    private OutputStream outputStream;

    public SerialLinkDriver(LinkConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "SERIAL";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void open(String address, Runnable onLinkLost) throws IOException {
        logger.info("Opening serial port {} at {} baud", address, config.serialBaudRate());
        SerialPort port = SerialPort.getCommPort(address);
        port.setBaudRate(config.serialBaudRate());
        port.setNumDataBits(8);
        port.setNumStopBits(1);
        port.setParity(SerialPort.NO_PARITY);
        port.setComPortTimeouts(SerialPort.TIMEOUT_WRITE_BLOCKING, 0, config.writeTimeout());

        if (!port.openPort()) {
            throw new IOException("Failed to open serial port: " + address);
        }

        port.addDataListener(new SerialPortDataListener() {
            @Override
            public int getListeningEvents() {
                return SerialPort.LISTENING_EVENT_PORT_DISCONNECTED;
            }

            @Override
            public void serialEvent(SerialPortEvent event) {
                logger.warn("Serial port {} disconnected", address);
                onLinkLost.run();
            }
        });

        this.serialPort = port;
        this.outputStream = port.getOutputStream();
    }

    @Override
    public OptionalInt requestMtu(int mtu) {
        return OptionalInt.of(config.serialChunkSize());
    }

    @Override
    public int getHeaderOverhead() {
        return 0;
    }

    @Override
    public List<GattService> discoverServices() {
        return List.of(new GattService(LinkConstants.SPP_UUID,
                List.of(GattCharacteristic.writable(LinkConstants.SPP_UUID))));
    }

    @Override
    public void write(WriteTarget target, byte[] chunk) throws IOException {
        if (outputStream == null) {
            throw new IOException("Serial port is not open");
        }
        outputStream.write(chunk);
        outputStream.flush();
    }

    @Override
    public void close() {
        if (serialPort != null) {
            serialPort.removeDataListener();
            if (serialPort.closePort()) {
                logger.debug("Serial port closed");
            } else {
                logger.warn("Serial port {} did not close cleanly", serialPort.getSystemPortName());
            }
        }
        serialPort = null;
        outputStream = null;
    }

    /**
     * Serial ports are enumerated at once; there is nothing to stop afterwards
     */
    @Override
    public void startScan(Consumer<DiscoveredDevice> onDeviceFound) {
        SerialPort[] ports = SerialPort.getCommPorts();
        logger.debug("Found {} serial port(s)", ports.length);
        for (SerialPort port : ports) {
            onDeviceFound.accept(new DiscoveredDevice(port.getSystemPortName(),
                    port.getDescriptivePortName(), null, List.of()));
        }
    }

    @Override
    public void stopScan() {
        logger.debug("Serial scan has nothing to stop");
    }
}
