package rawt.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.common.ELinkType;
import rawt.common.LinkConstants;
import rawt.common.ServerConstants;

import java.nio.file.Paths;
import java.util.Locale;

/**
 * Main configuration service - entry point for all configuration needs
 * @since 19/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private LinkConfig linkConfig;
    private ServerConfig serverConfig;
    private StoreConfig storeConfig;
    private JobConfig jobConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        load();
    }

    private void load() throws ConfigurationException {
        this.linkConfig = loadLinkConfiguration();
        this.serverConfig = loadServerConfiguration();
        this.storeConfig = loadStoreConfiguration();
        this.jobConfig = loadJobConfiguration();
    }

    /**
     * Load link configuration for the selected link type
     */
    private LinkConfig loadLinkConfiguration() throws ConfigurationException {
        String linkTypeStr = loader.getString("link.type", "NONE");
        ELinkType linkType;
        try {
            linkType = ELinkType.valueOf(linkTypeStr.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid link type '{}', defaulting to NONE", linkTypeStr);
            linkType = ELinkType.NONE;
        }

        int connectTimeout = loader.getInt("link.connect.timeout", LinkConstants.DEFAULT_CONNECT_TIMEOUT);
        int writeTimeout = loader.getInt("link.write.timeout", LinkConstants.DEFAULT_WRITE_TIMEOUT);
        int chunkDelay = loader.getInt("link.chunk.delay", LinkConstants.DEFAULT_CHUNK_DELAY_MS);

        LinkConfig config;
        switch (linkType) {
            case SERIAL:
                int baudRate = loader.getInt("link.serial.baud", 9600);
                int serialChunk = loader.getInt("link.serial.chunk", 256);
                config = LinkConfig.serial(baudRate, serialChunk, connectTimeout, writeTimeout, chunkDelay);
                logger.info("Configured SERIAL link: {} baud, {} byte chunks", baudRate, serialChunk);
                break;

            case NETWORK:
                int port = loader.getInt("link.network.port", LinkConstants.DEFAULT_NETWORK_PORT);
                int networkChunk = loader.getInt("link.network.chunk", 1024);
                config = LinkConfig.network(port, networkChunk, connectTimeout, writeTimeout, chunkDelay);
                logger.info("Configured NETWORK link: default port {}, {} byte chunks", port, networkChunk);
                break;

            case NONE:
                config = LinkConfig.dummy(loader.getInt("link.dummy.mtu", 185));
                logger.info("Configured DUMMY link");
                break;

            default:
                throw new ConfigurationException("Unsupported link type: " + linkType);
        }

        config.validate();
        return config;
    }

    private ServerConfig loadServerConfiguration() throws ConfigurationException {
        int port = loader.getInt("server.port", ServerConstants.SERVER_PORT);
        String host = loader.getString("server.host", ServerConstants.SERVER_IP);

        ServerConfig config = new ServerConfig(port, host);
        config.validate();
        return config;
    }

    private StoreConfig loadStoreConfiguration() throws ConfigurationException {
        String dataDir = loader.getString("store.data.dir", "data");
        if (dataDir == null || dataDir.isBlank()) {
            throw new ConfigurationException("Property 'store.data.dir' cannot be empty");
        }
        StoreConfig config = new StoreConfig(Paths.get(dataDir));
        config.validate();
        return config;
    }

    private JobConfig loadJobConfiguration() throws ConfigurationException {
        JobConfig config = new JobConfig(
                loader.getInt("job.page.delay", 500),
                loader.getInt("job.retained", 100));
        config.validate();
        return config;
    }

    public LinkConfig getLinkConfiguration() {
        return linkConfig;
    }

    public ServerConfig getServerConfiguration() {
        return serverConfig;
    }

    public StoreConfig getStoreConfiguration() {
        return storeConfig;
    }

    public JobConfig getJobConfiguration() {
        return jobConfig;
    }

    public void reload() throws ConfigurationException {
        logger.info("Reloading configuration...");
        loader.reload();
        load();

        logger.info("Configuration reloaded successfully");
        logger.info("Link: {}", linkConfig);
        logger.info("Server: {}", serverConfig);
        logger.info("Store: {}", storeConfig);
        logger.info("Jobs: {}", jobConfig);
    }
}
