package rawt.dal;

import rawt.common.ELinkType;
import rawt.common.LinkConstants;

/**
 * Type-safe configuration for the printer link.
 * The endpoint address itself comes from the selected saved printer, not from here.
 *
 * @since 19/10/2026
 */
public record LinkConfig(
        ELinkType linkType,
        int connectTimeout,
        int writeTimeout,
        int chunkDelayMs,
        int serialBaudRate,
        int serialChunkSize,
        int networkPort,
        int networkChunkSize,
        int dummyMtu) {

    public static LinkConfig serial(int baudRate, int chunkSize, int connectTimeout, int writeTimeout, int chunkDelayMs) {
        return new LinkConfig(ELinkType.SERIAL, connectTimeout, writeTimeout, chunkDelayMs,
                baudRate, chunkSize, LinkConstants.DEFAULT_NETWORK_PORT, 0, 0);
    }

    public static LinkConfig network(int port, int chunkSize, int connectTimeout, int writeTimeout, int chunkDelayMs) {
        return new LinkConfig(ELinkType.NETWORK, connectTimeout, writeTimeout, chunkDelayMs,
                0, 0, port, chunkSize, 0);
    }

    public static LinkConfig dummy(int mtu) {
        return new LinkConfig(ELinkType.NONE, LinkConstants.DEFAULT_CONNECT_TIMEOUT,
                LinkConstants.DEFAULT_WRITE_TIMEOUT, 0, 0, 0, LinkConstants.DEFAULT_NETWORK_PORT, 0, mtu);
    }

    public boolean isDummy() {
        return linkType == ELinkType.NONE;
    }

    @Override
    public String toString() {
        return switch (linkType) {
            case SERIAL -> String.format("LinkConfiguration{type=SERIAL, baud=%d, chunk=%d, connectTimeout=%d, writeTimeout=%d, delay=%dms}",
                    serialBaudRate, serialChunkSize, connectTimeout, writeTimeout, chunkDelayMs);
            case NETWORK -> String.format("LinkConfiguration{type=NETWORK, port=%d, chunk=%d, connectTimeout=%d, writeTimeout=%d, delay=%dms}",
                    networkPort, networkChunkSize, connectTimeout, writeTimeout, chunkDelayMs);
            case NONE -> String.format("LinkConfiguration{type=NONE (Dummy), mtu=%d}", dummyMtu);
        };
    }

    public void validate() throws ConfigurationException {
        if (linkType == null) {
            throw new ConfigurationException("Link type cannot be null");
        }
        if (connectTimeout < 100) {
            throw new ConfigurationException("Connect timeout must be at least 100ms");
        }
        if (writeTimeout < 100) {
            throw new ConfigurationException("Write timeout must be at least 100ms");
        }
        if (chunkDelayMs < 0 || chunkDelayMs > 1000) {
            throw new ConfigurationException("Chunk delay must be between 0 and 1000ms");
        }

        switch (linkType) {
            case SERIAL -> validateSerialConfig();
            case NETWORK -> validateNetworkConfig();
            case NONE -> {
                if (dummyMtu < LinkConstants.DEFAULT_MTU || dummyMtu > LinkConstants.REQUESTED_MTU) {
                    throw new ConfigurationException("Dummy MTU must be between "
                            + LinkConstants.DEFAULT_MTU + " and " + LinkConstants.REQUESTED_MTU);
                }
            }
        }
    }

    private void validateSerialConfig() throws ConfigurationException {
        if (serialBaudRate < 300 || serialBaudRate > 921600) {
            throw new ConfigurationException("Baud rate must be between 300 and 921600");
        }
        if (serialChunkSize < 1) {
            throw new ConfigurationException("Serial chunk size must be positive");
        }
    }

    private void validateNetworkConfig() throws ConfigurationException {
        if (networkPort < 1 || networkPort > 65535) {
            throw new ConfigurationException("Network port must be between 1 and 65535");
        }
        if (networkChunkSize < 1) {
            throw new ConfigurationException("Network chunk size must be positive");
        }
    }
}
