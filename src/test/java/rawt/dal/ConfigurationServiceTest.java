package rawt.dal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rawt.common.ELinkType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ConfigurationService
 * @since 19/10/2026
 */
class ConfigurationServiceTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("link.type");
        System.clearProperty("link.network.port");
        System.clearProperty("link.serial.baud");
        System.clearProperty("server.port");
        System.clearProperty("job.page.delay");
        System.clearProperty("store.data.dir");
    }

    @Test
    @DisplayName("Should load dummy link by default")
    void shouldLoadDummyLinkByDefault() throws ConfigurationException {
        // When
        ConfigurationService service = new ConfigurationService();
        LinkConfig config = service.getLinkConfiguration();

        // Then
        assertThat(config.isDummy()).isTrue();
        assertThat(config.dummyMtu()).isEqualTo(185);
    }

    @Test
    @DisplayName("Should load valid network link configuration")
    void shouldLoadValidNetworkLinkConfiguration() throws ConfigurationException {
        // Given
        System.setProperty("link.type", "network");
        System.setProperty("link.network.port", "9101");

        // When
        LinkConfig config = new ConfigurationService().getLinkConfiguration();

        // Then
        assertThat(config.linkType()).isEqualTo(ELinkType.NETWORK);
        assertThat(config.networkPort()).isEqualTo(9101);
        assertThat(config.networkChunkSize()).isEqualTo(1024);
    }

    @Test
    @DisplayName("Should fall back to dummy link for unknown link type")
    void shouldFallBackToDummyForUnknownLinkType() throws ConfigurationException {
        // Given
        System.setProperty("link.type", "CARRIER_PIGEON");

        // When
        LinkConfig config = new ConfigurationService().getLinkConfiguration();

        // Then
        assertThat(config.linkType()).isEqualTo(ELinkType.NONE);
    }

    @Test
    @DisplayName("Should throw exception for invalid baud rate")
    void shouldThrowExceptionForInvalidBaudRate() {
        // Given
        System.setProperty("link.type", "SERIAL");
        System.setProperty("link.serial.baud", "50");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Baud rate must be between");
    }

    @Test
    @DisplayName("Should throw exception for invalid server port")
    void shouldThrowExceptionForInvalidServerPort() {
        // Given
        System.setProperty("server.port", "99999");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("port must be between 1 and 65535");
    }

    @Test
    @DisplayName("Should reject negative page delay")
    void shouldRejectNegativePageDelay() {
        // Given
        System.setProperty("job.page.delay", "-1");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Page delay");
    }

    @Test
    @DisplayName("Should derive store locations from data directory")
    void shouldDeriveStoreLocations() throws ConfigurationException {
        // Given
        System.setProperty("store.data.dir", "target/test-data");

        // When
        StoreConfig config = new ConfigurationService().getStoreConfiguration();

        // Then
        assertThat(config.pendingJobsFile().toString()).endsWith("pending-jobs.json");
        assertThat(config.settingsFile().getParent()).isEqualTo(config.dataDirectory());
        assertThat(config.spoolDirectory().getFileName().toString()).isEqualTo("spool");
    }
}
