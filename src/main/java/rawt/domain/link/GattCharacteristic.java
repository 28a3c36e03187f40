package rawt.domain.link;

/**
 * Characteristic exposed by a service; only writable ones can carry print data
 * @since 19/10/2026
 */
public record GattCharacteristic(String uuid, boolean write, boolean writeWithoutResponse) {

    public static GattCharacteristic writable(String uuid) {
        return new GattCharacteristic(uuid, true, true);
    }

    public static GattCharacteristic readOnly(String uuid) {
        return new GattCharacteristic(uuid, false, false);
    }

    public boolean isWritable() {
        return write || writeWithoutResponse;
    }
}
