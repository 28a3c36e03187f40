package rawt.domain.escpos;

import java.util.List;

/**
 * Receipt template content
 * @since 19/10/2026
 */
public record Receipt(String header, String subheader, List<Item> items, String total, String footer) {

    public record Item(String name, String price) {
    }

    public Receipt {
        if (header == null || header.isBlank()) {
            throw new IllegalArgumentException("Receipt header is required");
        }
        if (total == null) {
            throw new IllegalArgumentException("Receipt total is required");
        }
        items = items == null ? List.of() : List.copyOf(items);
    }
}
