package rawt.common;

import java.util.List;

/**
 * Link layer constants: well-known service identifiers and MTU limits
 * @since 19/10/2026
 */
public final class LinkConstants {
    private LinkConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    // Standard printer service and its write characteristic
    public static final String PRINTER_SERVICE_UUID = "000018f0-0000-1000-8000-00805f9b34fb";
    public static final String PRINTER_CHARACTERISTIC_UUID = "00002af1-0000-1000-8000-00805f9b34fb";

    // Vendor service found on many clone printers (ISSC transparent UART)
    public static final String ALTERNATE_SERVICE_UUID = "49535343-fe7d-4ae5-8fa9-9fafd205e455";

    // Classic serial port profile
    public static final String SPP_UUID = "00001101-0000-1000-8000-00805f9b34fb";

    public static final int DEFAULT_MTU = 23;
    public static final int REQUESTED_MTU = 512;
    public static final int ATT_HEADER_SIZE = 3;

    public static final int DEFAULT_CONNECT_TIMEOUT = 10000;
    public static final int DEFAULT_WRITE_TIMEOUT = 5000;
    public static final int DEFAULT_CHUNK_DELAY_MS = 2;
    public static final int DEFAULT_NETWORK_PORT = 9100;

    // Name fragments that usually identify a receipt printer during a scan
    public static final List<String> PRINTER_NAME_HINTS = List.of(
            "printer", "print", "pos", "thermal", "receipt",
            "epson", "star", "xprinter", "goojprt", "peripage",
            "mpt-", "zj-", "rpp", "spp");
}
