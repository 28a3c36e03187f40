package rawt.domain;

import com.google.common.eventbus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.ServerConfig;
import rawt.domain.job.PrintJobOrchestrator;
import rawt.domain.link.ILinkTransport;
import rawt.domain.orchestration.ShutdownManager;
import rawt.domain.orchestration.WebServerManager;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the running application together: job queue, SSE, web server and shutdown
 * @since 19/10/2026
 */
public class AppController {
    private static final Logger logger = LoggerFactory.getLogger(AppController.class);

    private final ServerConfig serverConfig;
    private final EventBus eventBus;
    private final PrintJobOrchestrator orchestrator;
    private final ILinkTransport transport;
    private final SSEManager sseManager;
    private final WebServerManager webServerManager;
    private final ScheduledExecutorService executorService;
    private final ShutdownManager shutdownManager;

    public AppController(ServerConfig serverConfig, EventBus eventBus, PrintJobOrchestrator orchestrator,
                         ILinkTransport transport, SSEManager sseManager, WebServerManager webServerManager) {
        this.serverConfig = serverConfig;
        this.eventBus = eventBus;
        this.orchestrator = orchestrator;
        this.transport = transport;
        this.sseManager = sseManager;
        this.webServerManager = webServerManager;
        this.executorService = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "sse-maintenance");
            thread.setDaemon(true);
            return thread;
        });
        this.shutdownManager = new ShutdownManager(sseManager, webServerManager, executorService, orchestrator, transport);
    }

    public void start() {
        logger.info("========================================");
        logger.info("Starting RawThermal print server");
        logger.info("========================================");

        try {
            // Step 1: SSE before the queue so replayed jobs are broadcast
            eventBus.register(sseManager);
            sseManager.startSSEManagementTasks(executorService);

            // Step 2: Job queue, replays jobs left from the last run
            orchestrator.start();

            // Step 3: Web server
            webServerManager.start();

            // Step 4: Shutdown hook
            shutdownManager.registerShutdownHook();

            logger.info("✓ RawThermal ready on http://{}:{} (link state {})",
                    serverConfig.host(), serverConfig.port(), transport.getState());
        } catch (RuntimeException e) {
            logger.error("Startup failed", e);
            shutdownManager.shutdown();
            throw e;
        }
    }

    public void shutdown() {
        shutdownManager.shutdown();
    }
}
