package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Resolves configuration strings such as {@code notify-subject-group} or
 * {@code High} onto enum constants.
 */
final class Names {

    private Names() {
        // utility class, not instantiable
    }

    static <E extends Enum<E>> E parse(Class<E> type, String raw, String what) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(what + " is required");
        }
        String normalised = raw.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalised);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + what + ": '" + raw + "'. Supported: "
                    + Arrays.stream(type.getEnumConstants())
                            .map(Names::wireName)
                            .collect(Collectors.joining(", ")));
        }
    }

    static String wireName(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
