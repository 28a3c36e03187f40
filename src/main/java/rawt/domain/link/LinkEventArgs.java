package rawt.domain.link;

/**
 * Events published by the transport
 * @since 19/10/2026
 */
public class LinkEventArgs {
    public enum EType {
        STATE_CHANGED,
        DEVICE_FOUND
    }

    private final EType type;
    private final ELinkState state;
    private final String endpointId;
    private final String reason;
    private final DiscoveredDevice device;
    private final long timestamp;

    private LinkEventArgs(EType type, ELinkState state, String endpointId, String reason, DiscoveredDevice device) {
        this.type = type;
        this.state = state;
        this.endpointId = endpointId;
        this.reason = reason;
        this.device = device;
        this.timestamp = System.currentTimeMillis();
    }

    public static LinkEventArgs stateChanged(ELinkState state, String endpointId, String reason) {
        return new LinkEventArgs(EType.STATE_CHANGED, state, endpointId, reason, null);
    }

    public static LinkEventArgs deviceFound(DiscoveredDevice device) {
        return new LinkEventArgs(EType.DEVICE_FOUND, null, null, null, device);
    }

    public EType getType() {
        return type;
    }

    public ELinkState getState() {
        return state;
    }

    public String getEndpointId() {
        return endpointId;
    }

    public String getReason() {
        return reason;
    }

    public DiscoveredDevice getDevice() {
        return device;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return type == EType.STATE_CHANGED
                ? "LinkEventArgs [state=" + state + ", endpoint=" + endpointId + ", reason=" + reason + "]"
                : "LinkEventArgs [device=" + device + "]";
    }
}
