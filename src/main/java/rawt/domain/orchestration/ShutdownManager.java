package rawt.domain.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.domain.SSEManager;
import rawt.domain.job.PrintJobOrchestrator;
import rawt.domain.link.ILinkTransport;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages graceful shutdown of the application
 * @since 19/10/2026
 */
public class ShutdownManager {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownManager.class);

    private final SSEManager sseManager;
    private final WebServerManager webServerManager;
    private final ScheduledExecutorService executorService;
    private final PrintJobOrchestrator orchestrator;
    private final ILinkTransport transport;

    private volatile boolean shutdownHookRegistered = false;
    private volatile boolean shutDown = false;

    public ShutdownManager(SSEManager sseManager,
                           WebServerManager webServerManager,
                           ScheduledExecutorService executorService,
                           PrintJobOrchestrator orchestrator,
                           ILinkTransport transport) {
        this.sseManager = sseManager;
        this.webServerManager = webServerManager;
        this.executorService = executorService;
        this.orchestrator = orchestrator;
        this.transport = transport;
    }

    public void registerShutdownHook() {
        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown"));
            shutdownHookRegistered = true;
        }
    }

    /**
     * Stop in order: SSE, web server, print worker, link. Safe to call twice.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        logger.info("Shutting down RawThermal...");

        try {
            sseManager.stopSSEManagementTasks();
            sseManager.closeAllClients();

            webServerManager.stop();

            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Executor did not terminate in time, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }

            orchestrator.close();
            transport.close();

            logger.info("Application shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        }
    }
}
