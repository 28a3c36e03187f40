package rawt.domain;

import com.google.common.eventbus.Subscribe;
import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.common.ServerConstants;
import rawt.domain.job.PrintJobEvent;
import rawt.domain.job.PrinterSetupRequiredEvent;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pushes job events to SSE clients. Registered on the event bus.
 * @since 19/10/2026
 */
public class SSEManager {
    private static final Logger logger = LoggerFactory.getLogger(SSEManager.class);

    // Compact Gson: SSE data must stay on one line
    private final Gson compactGson = new Gson();
    private final ConcurrentHashMap<String, SSEClient> jobClients = new ConcurrentHashMap<>();

    private ScheduledFuture<?> cleanupTask;
    private ScheduledFuture<?> heartbeatTask;

    public boolean canAcceptClient() {
        return jobClients.size() < ServerConstants.SSE_MAX_CLIENTS;
    }

    public void registerClient(SSEClient client) {
        jobClients.put(client.getClientId(), client);
        logger.info("Job SSE client registered: {} (total clients: {})", client.getClientId(), jobClients.size());
    }

    public void unregisterClient(String clientId) {
        SSEClient client = jobClients.remove(clientId);
        if (client != null) {
            client.close();
            logger.info("Job SSE client unregistered: {} (total clients: {})", clientId, jobClients.size());
        }
    }

    public int getClientCount() {
        return jobClients.size();
    }

    @Subscribe
    public void onPrintJobEvent(PrintJobEvent event) {
        broadcast("job", compactGson.toJson(event.getJob()));
    }

    @Subscribe
    public void onPrinterSetupRequired(PrinterSetupRequiredEvent event) {
        broadcast("setup-required", compactGson.toJson(event));
    }

    public void broadcast(String eventType, String data) {
        if (jobClients.isEmpty()) {
            return;
        }
        logger.debug("Broadcasting '{}' to {} job SSE clients", eventType, jobClients.size());

        int failureCount = 0;
        for (SSEClient client : jobClients.values()) {
            if (!client.sendEvent(eventType, data)) {
                failureCount++;
                logger.debug("Failed to send to job client: {}", client);
            }
        }
        if (failureCount > 0) {
            logger.debug("Broadcast complete: {} failed", failureCount);
        }
    }

    public void startSSEManagementTasks(ScheduledExecutorService executorService) {
        heartbeatTask = executorService.scheduleAtFixedRate(this::sendHeartbeatToAllClients,
                ServerConstants.SSE_HEARTBEAT_INTERVAL_MS, ServerConstants.SSE_HEARTBEAT_INTERVAL_MS, TimeUnit.MILLISECONDS);
        cleanupTask = executorService.scheduleAtFixedRate(this::cleanupStaleClients,
                ServerConstants.SSE_CLEANUP_INTERVAL_MS, ServerConstants.SSE_CLEANUP_INTERVAL_MS, TimeUnit.MILLISECONDS);
        logger.info("✓ SSE management tasks started");
    }

    public void stopSSEManagementTasks() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
    }

    private void sendHeartbeatToAllClients() {
        for (SSEClient client : jobClients.values()) {
            if (client.needsHeartbeat(ServerConstants.SSE_HEARTBEAT_INTERVAL_MS) && !client.sendHeartbeat()) {
                logger.debug("Heartbeat failed for job client: {}", client);
            }
        }
    }

    void cleanupStaleClients() {
        int removedCount = 0;
        for (var entry : jobClients.entrySet()) {
            SSEClient client = entry.getValue();
            if (!client.isActive() || client.isStale(ServerConstants.SSE_CLIENT_TIMEOUT_MS)) {
                logger.info("Removing {} job SSE client: {}", client.isActive() ? "stale" : "inactive", client.getClientId());
                client.close();
                jobClients.remove(entry.getKey());
                removedCount++;
            }
        }
        if (removedCount > 0) {
            logger.info("Cleaned up {} stale SSE clients", removedCount);
        }
    }

    public void closeAllClients() {
        jobClients.values().forEach(SSEClient::close);
        jobClients.clear();
    }
}
