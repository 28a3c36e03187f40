package rawt.dal;

/**
 * Type-safe configuration for the HTTP server
 * @since 19/10/2026
 */
public record ServerConfig(int port, String host) {

    @Override
    public String toString() {
        return String.format("ServerConfiguration{port=%d, host='%s'}", port, host);
    }

    public void validate() throws ConfigurationException {
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Server port must be between 1 and 65535");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new ConfigurationException("Server host cannot be empty");
        }
    }
}
