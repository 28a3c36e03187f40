package rawt.domain.link;

import java.util.List;
import java.util.Optional;

/**
 * A service discovered on the endpoint
 * @since 19/10/2026
 */
public record GattService(String uuid, List<GattCharacteristic> characteristics) {

    public GattService {
        characteristics = characteristics == null ? List.of() : List.copyOf(characteristics);
    }

    public Optional<GattCharacteristic> findWritable() {
        return characteristics.stream().filter(GattCharacteristic::isWritable).findFirst();
    }

    public Optional<GattCharacteristic> findWritable(String characteristicUuid) {
        return characteristics.stream()
                .filter(c -> c.uuid().equalsIgnoreCase(characteristicUuid) && c.isWritable())
                .findFirst();
    }
}
