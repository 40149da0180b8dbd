package com.example.rbac.authz.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operations a subject can perform on a {@link Resource}.
 */
public enum Action {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    APPROVE,
    ASSIGN,
    EXPORT,
    IMPORT,
    CONFIGURE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Action> tryFromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim();
        return Arrays.stream(values())
                .filter(action -> action.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
