package rawt.domain.link;

/**
 * Transport connection states
 * @since 19/10/2026
 */
public enum ELinkState {
    DISCONNECTED,   // No endpoint; initial state and state after disconnect or link loss
    CONNECTING,     // Opening the link, negotiating MTU, discovering services
    CONNECTED       // Write target selected, writes allowed
}
