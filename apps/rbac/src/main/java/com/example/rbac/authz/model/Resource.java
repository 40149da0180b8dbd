package com.example.rbac.authz.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Protectable object classes.
 *
 * <p>Wire keys are the lower-case constant names ({@code ai_insights}, {@code projects}).
 */
public enum Resource {
    PROJECTS,
    TASKS,
    RESOURCES,
    CLIENTS,
    REPORTS,
    SETTINGS,
    USERS,
    BILLING,
    AUTOMATION,
    AI_INSIGHTS;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Resource> tryFromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim();
        return Arrays.stream(values())
                .filter(resource -> resource.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
