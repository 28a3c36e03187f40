package rawt;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.ConfigurationService;
import rawt.domain.AppController;

/**
 * Main entry point for the RawThermal print server
 * @since 19/10/2026
 */
public class RawThermal {
    private static final Logger logger = LoggerFactory.getLogger(RawThermal.class);

    public static void main(String[] args) {
        logger.info("Starting RawThermal Application...");

        try {
            ConfigurationService configService = new ConfigurationService();

            logger.info("Configuration loaded successfully");
            logger.debug("Link: {}", configService.getLinkConfiguration());
            logger.debug("Server: {}", configService.getServerConfiguration());
            logger.debug("Store: {}", configService.getStoreConfiguration());
            logger.debug("Jobs: {}", configService.getJobConfiguration());

            Injector injector = Guice.createInjector(new GuiceModule(configService));

            AppController app = injector.getInstance(AppController.class);
            app.start();

        } catch (Exception e) {
            logger.error("Failed to start application", e);
            System.exit(1);
        }
    }
}
