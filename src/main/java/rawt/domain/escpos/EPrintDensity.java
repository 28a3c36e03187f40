package rawt.domain.escpos;

import java.util.Locale;

/**
 * Named print density presets mapped onto the GS | level range 0..7
 * @since 19/10/2026
 */
public enum EPrintDensity {
    LIGHT(1),
    NORMAL(4),
    DARK(7);

    private final int level;

    EPrintDensity(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public static EPrintDensity fromName(String name) {
        if (name == null || name.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported print density: " + name, e);
        }
    }
}
