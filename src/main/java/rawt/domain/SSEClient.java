package rawt.domain;

import io.javalin.http.sse.SseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * SSE (Server-Sent Events) client connection with activity bookkeeping
 * @since 19/10/2026
 */
public class SSEClient {
    private static final Logger logger = LoggerFactory.getLogger(SSEClient.class);

    private final String clientId;
    private final SseClient sseClient;
    private final long connectedAt;
    private volatile long lastMessageAt;
    private volatile long lastHeartbeatAt;
    private final AtomicLong messagesSent = new AtomicLong();
    private volatile boolean active = true;

    public SSEClient(String clientId, SseClient sseClient) {
        this.clientId = clientId;
        this.sseClient = sseClient;
        this.connectedAt = System.currentTimeMillis();
        this.lastMessageAt = connectedAt;
        this.lastHeartbeatAt = connectedAt;
    }

    /**
     * @return false if the client is gone; the client is then marked inactive
     */
    public boolean sendEvent(String eventType, String data) {
        if (!active) {
            return false;
        }
        try {
            logger.trace("Sending SSE event '{}' to client {}: {}", eventType, clientId,
                    data.length() > 100 ? data.substring(0, 100) + "..." : data);
            sseClient.sendEvent(eventType, data);
            lastMessageAt = System.currentTimeMillis();
            messagesSent.incrementAndGet();
            return true;
        } catch (Exception e) {
            logger.error("Failed to send message to client {}: {}", clientId, e.getMessage());
            active = false;
            return false;
        }
    }

    public boolean sendHeartbeat() {
        if (!active) {
            return false;
        }
        try {
            sseClient.sendComment("heartbeat");
            lastHeartbeatAt = System.currentTimeMillis();
            return true;
        } catch (Exception e) {
            logger.debug("Failed to send heartbeat to client {}: {}", clientId, e.getMessage());
            active = false;
            return false;
        }
    }

    /**
     * Stale when neither a message nor a heartbeat went out within {@code timeoutMs}
     */
    public boolean isStale(long timeoutMs) {
        long lastActivity = Math.max(lastMessageAt, lastHeartbeatAt);
        return System.currentTimeMillis() - lastActivity > timeoutMs;
    }

    public boolean needsHeartbeat(long heartbeatIntervalMs) {
        return System.currentTimeMillis() - lastHeartbeatAt > heartbeatIntervalMs;
    }

    public void close() {
        active = false;
        try {
            sseClient.close();
            logger.debug("Closed SSE client {}", clientId);
        } catch (Exception e) {
            logger.debug("Error closing SSE client {}: {}", clientId, e.getMessage());
        }
    }

    public String getClientId() {
        return clientId;
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public String toString() {
        return String.format("SSEClient{id='%s', connected=%dms, messages=%d, active=%s}",
                clientId, System.currentTimeMillis() - connectedAt, messagesSent.get(), active);
    }
}
