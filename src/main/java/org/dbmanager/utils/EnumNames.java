package org.dbmanager.utils;

import java.util.Locale;
import java.util.Optional;

/**
 * Lenient lookup of enum constants by name.
 * <p>
 * Names are compared ignoring case and underscores, so {@code DontCare}, {@code DONT_CARE} and
 * {@code dontcare} all resolve to {@code DONT_CARE}. Used for configuration values and inline
 * script directives, both of which are written by hand.
 */
public final class EnumNames {

    private EnumNames() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolves {@code value} to a constant of {@code type}.
     *
     * @param type  the enum type
     * @param value the name to resolve, may be {@code null}
     * @param <E>   the enum type
     * @return the matching constant, or empty if {@code value} is blank or unknown
     */
    public static <E extends Enum<E>> Optional<E> parse(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(value);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(normalized)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String name) {
        return name.trim().replace("_", "").toUpperCase(Locale.ROOT);
    }
}
