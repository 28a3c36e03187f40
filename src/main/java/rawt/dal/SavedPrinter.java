package rawt.dal;

import rawt.common.ELinkType;
import rawt.common.EPaperWidth;

/**
 * A printer remembered by the user: where to reach it and which paper it takes
 * @since 19/10/2026
 */
public record SavedPrinter(String id, String name, ELinkType linkType, String address, EPaperWidth paperWidth) {

    public SavedPrinter {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Printer id cannot be empty");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Printer address cannot be empty");
        }
        if (name == null || name.isBlank()) {
            name = address;
        }
        if (linkType == null) {
            linkType = ELinkType.SERIAL;
        }
        if (paperWidth == null) {
            paperWidth = EPaperWidth.MM_58;
        }
    }

    @Override
    public String toString() {
        return String.format("SavedPrinter{id='%s', name='%s', type=%s, address='%s', paper=%dmm}",
                id, name, linkType, address, paperWidth.getMillimeters());
    }
}
