package rawt.domain.link;

import rawt.common.LinkConstants;

import java.util.List;
import java.util.Locale;

/**
 * Device seen during a scan
 * @since 19/10/2026
 */
public record DiscoveredDevice(String id, String name, Integer rssi, List<String> serviceUuids) {

    public DiscoveredDevice {
        serviceUuids = serviceUuids == null ? List.of() : List.copyOf(serviceUuids);
    }

    /**
     * Name or advertised services suggest a receipt printer
     */
    public boolean isProbablyPrinter() {
        for (String uuid : serviceUuids) {
            if (uuid.equalsIgnoreCase(LinkConstants.PRINTER_SERVICE_UUID)
                    || uuid.equalsIgnoreCase(LinkConstants.ALTERNATE_SERVICE_UUID)
                    || uuid.equalsIgnoreCase(LinkConstants.SPP_UUID)) {
                return true;
            }
        }
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return LinkConstants.PRINTER_NAME_HINTS.stream().anyMatch(lower::contains);
    }
}
