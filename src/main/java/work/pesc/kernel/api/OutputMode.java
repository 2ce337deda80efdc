package work.pesc.kernel.api;

import java.util.Locale;

/**
 * How the stack is shown after each evaluation.
 */
public enum OutputMode {
    HUMAN,
    SIMPLE,
    MACHINE,
    QUIET;

    public static OutputMode auto() {
        return System.console() != null ? HUMAN : SIMPLE;
    }

    /**
     * Parses a mode name; {@code auto}, blank or null picks {@link #auto()}.
     */
    public static OutputMode from(String value) {
        if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value.trim())) {
            return auto();
        }
        try {
            return OutputMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output mode: " + value);
        }
    }
}
