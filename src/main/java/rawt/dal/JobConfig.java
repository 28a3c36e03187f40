package rawt.dal;

/**
 * Job processing parameters
 * @since 19/10/2026
 */
public record JobConfig(int pageDelayMs, int retainedJobs) {

    public void validate() throws ConfigurationException {
        if (pageDelayMs < 0) {
            throw new ConfigurationException("Page delay cannot be negative");
        }
        if (retainedJobs < 1) {
            throw new ConfigurationException("At least one finished job must be retained");
        }
    }

    @Override
    public String toString() {
        return String.format("JobConfiguration{pageDelay=%dms, retained=%d}", pageDelayMs, retainedJobs);
    }
}
