package rawt.common;

/**
 * Web Server Parameters
 * @since 19/10/2026
 */
public final class ServerConstants {
    private ServerConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final int SERVER_PORT = 8090;
    public static final String SERVER_IP = "0.0.0.0";

    // SSE Configuration
    public static final long SSE_HEARTBEAT_INTERVAL_MS = 30_000;     // 30 seconds
    public static final long SSE_CLIENT_TIMEOUT_MS = 120_000;        // 2 minutes without activity
    public static final long SSE_CLEANUP_INTERVAL_MS = 60_000;       // 1 minute
    public static final int SSE_MAX_CLIENTS = 10;                    // Maximum concurrent SSE clients
}
