package rawt.dal;

import java.nio.file.Path;

/**
 * Location of the durable stores (settings, pending jobs, spool)
 * @since 19/10/2026
 */
public record StoreConfig(Path dataDirectory) {

    public Path settingsFile() {
        return dataDirectory.resolve("printer-settings.json");
    }

    public Path pendingJobsFile() {
        return dataDirectory.resolve("pending-jobs.json");
    }

    public Path pendingContentDirectory() {
        return dataDirectory.resolve("pending");
    }

    public Path spoolDirectory() {
        return dataDirectory.resolve("spool");
    }

    public void validate() throws ConfigurationException {
        if (dataDirectory == null || dataDirectory.toString().isBlank()) {
            throw new ConfigurationException("Data directory cannot be empty");
        }
    }

    @Override
    public String toString() {
        return String.format("StoreConfiguration{dataDir='%s'}", dataDirectory.toAbsolutePath());
    }
}
