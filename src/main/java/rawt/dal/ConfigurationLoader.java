package rawt.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Loads configuration with priority:
 * 1. System Properties
 * 2. Environment Variables (dots to underscores, upper case)
 * 3. External application.properties (working directory config/, or -Dconfig.dir / CONFIG_DIR)
 * 4. Classpath application.properties (embedded in JAR)
 *
 * <p>For IDE debugging, point at an external config directory with:</p>
 * <pre>-Dconfig.dir=/path/to/config</pre>
 *
 * @since 19/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_FILE = "application.properties";

    private final String configFile;
    private final Properties properties;

    public ConfigurationLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    public ConfigurationLoader(String configFile) {
        this.configFile = configFile;
        this.properties = loadProperties(configFile);
    }

    /**
     * External values win over classpath defaults key by key
     */
    private Properties loadProperties(String configFile) {
        Properties props = new Properties();

        Path configPath = Paths.get(configFile);
        if (configPath.isAbsolute()) {
            if (loadFile(configPath, props)) {
                logger.info("Loaded configuration from absolute path: {}", configPath);
            } else {
                logger.warn("Configuration file not found: {}", configPath);
            }
            return props;
        }

        Properties defaults = loadFromClasspath(configFile);
        props.putAll(defaults);

        Path external = findExternalConfig(configFile);
        if (external != null) {
            Properties externalProps = new Properties();
            if (loadFile(external, externalProps)) {
                props.putAll(externalProps);
                logger.info("Loaded external configuration from: {}", external.toAbsolutePath());
            }
        } else if (!defaults.isEmpty()) {
            logger.info("Loaded configuration from classpath '{}'", configFile);
        }

        if (props.isEmpty()) {
            logger.warn("No configuration file found, using built-in defaults only");
        }
        return props;
    }

    private Path findExternalConfig(String configFile) {
        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            Path explicit = Paths.get(configDir, configFile).normalize();
            if (Files.isRegularFile(explicit)) {
                return explicit;
            }
            logger.warn("Config directory specified but file not found: {}", explicit.toAbsolutePath());
            return null;
        }

        Path local = Paths.get("config", configFile).normalize();
        if (Files.isRegularFile(local)) {
            return local;
        }
        logger.trace("External config not found at: {}", local.toAbsolutePath());
        return null;
    }

    private static boolean loadFile(Path path, Properties target) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try (InputStream input = Files.newInputStream(path)) {
            target.load(input);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to load configuration from '{}': {}", path, e.getMessage());
            return false;
        }
    }

    private Properties loadFromClasspath(String configFile) {
        Properties props = new Properties();
        String[] classpathLocations = {configFile, "config/" + configFile};

        for (String location : classpathLocations) {
            try (InputStream input = getClass().getClassLoader().getResourceAsStream(location)) {
                if (input != null) {
                    props.load(input);
                    logger.debug("Loaded classpath configuration from '{}'", location);
                    return props;
                }
            } catch (IOException e) {
                logger.debug("Error loading configuration from classpath '{}': {}", location, e.getMessage());
            }
        }
        return props;
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from System Properties: {}", key, value);
            return value;
        }

        String envKey = key.replace('.', '_').toUpperCase(Locale.ROOT);
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from Environment Variable '{}': {}", key, envKey, value);
            return value;
        }

        value = properties.getProperty(key);
        if (value != null) {
            return value.trim();
        }

        logger.debug("Property '{}' not found, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Get required string property (throws exception if missing)
     */
    public String getRequiredString(String key) throws ConfigurationException {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Required property '" + key + "' is not configured");
        }
        return value;
    }

    public Properties getAllProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }

    public void reload() {
        Properties newProps = loadProperties(configFile);
        properties.clear();
        properties.putAll(newProps);
        logger.info("Configuration reloaded");
    }
}
