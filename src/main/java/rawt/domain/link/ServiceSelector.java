package rawt.domain.link;

import rawt.common.LinkConstants;

import java.util.List;
import java.util.Optional;

/**
 * Chooses where print data is written, in priority order:
 * <ol>
 *     <li>the standard printer service, preferring its known characteristic</li>
 *     <li>the alternate vendor service</li>
 *     <li>any service with a writable characteristic</li>
 * </ol>
 * @since 19/10/2026
 */
public final class ServiceSelector {
    private ServiceSelector() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static Optional<WriteTarget> select(List<GattService> services) {
        for (GattService service : services) {
            if (service.uuid().equalsIgnoreCase(LinkConstants.PRINTER_SERVICE_UUID)) {
                Optional<GattCharacteristic> characteristic = service.findWritable(LinkConstants.PRINTER_CHARACTERISTIC_UUID)
                        .or(service::findWritable);
                if (characteristic.isPresent()) {
                    return Optional.of(new WriteTarget(service, characteristic.get()));
                }
            }
        }

        for (GattService service : services) {
            if (service.uuid().equalsIgnoreCase(LinkConstants.ALTERNATE_SERVICE_UUID)) {
                Optional<GattCharacteristic> characteristic = service.findWritable();
                if (characteristic.isPresent()) {
                    return Optional.of(new WriteTarget(service, characteristic.get()));
                }
            }
        }

        for (GattService service : services) {
            Optional<GattCharacteristic> characteristic = service.findWritable();
            if (characteristic.isPresent()) {
                return Optional.of(new WriteTarget(service, characteristic.get()));
            }
        }
        return Optional.empty();
    }
}
