package rawt.domain.link;

import rawt.common.EPaperWidth;

/**
 * The live connection target. Exists only while the transport is connected.
 * @since 19/10/2026
 */
public record PrinterEndpoint(String id, EPaperWidth paperWidth, int mtu, int maxChunkPayload,
                              String serviceUuid, String characteristicUuid) {

    @Override
    public String toString() {
        return String.format("PrinterEndpoint{id='%s', paper=%dmm, mtu=%d, payload=%d, target=%s/%s}",
                id, paperWidth.getMillimeters(), mtu, maxChunkPayload, serviceUuid, characteristicUuid);
    }
}
