package rawt.domain.link;

/**
 * Service and characteristic chosen to receive print data
 * @since 19/10/2026
 */
public record WriteTarget(GattService service, GattCharacteristic characteristic) {

    @Override
    public String toString() {
        return service.uuid() + "/" + characteristic.uuid();
    }
}
