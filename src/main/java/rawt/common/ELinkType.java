package rawt.common;

/**
 * Physical link used to reach the printer
 * @since 19/10/2026
 */
public enum ELinkType {
    SERIAL,   // Bluetooth SPP or USB COM port
    NETWORK,  // Raw TCP (port 9100)
    NONE      // Dummy mode (no physical printer)
}
