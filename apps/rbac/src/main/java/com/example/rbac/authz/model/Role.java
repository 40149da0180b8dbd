package com.example.rbac.authz.model;

import com.example.rbac.authz.exception.InvalidRoleException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Privilege tiers, declared from least to most privileged.
 *
 * <p>Declaration order is the hierarchy: {@code rank() == ordinal()}.
 * Do not reorder constants without reviewing the catalog in {@code application.yml}.
 */
public enum Role {
    /**
     * Unauthenticated or invited visitor. Read-only view of public project data.
     */
    GUEST,

    /**
     * Customer of the agency. Owns projects and tasks raised on their behalf.
     */
    CLIENT,

    /**
     * Delivery staff working on assigned projects.
     */
    DEVELOPER,

    /**
     * Team lead. Approves work and assigns people.
     */
    MANAGER,

    /**
     * Full system administrator.
     */
    ADMIN;

    /**
     * Position in the hierarchy, 0 = least privileged.
     */
    public int rank() {
        return ordinal();
    }

    /**
     * Wire form, e.g. {@code "developer"}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a role key from configuration.
     *
     * @throws InvalidRoleException if the key is not one of the enumerated roles
     */
    public static Role fromKey(String key) {
        return tryFromKey(key).orElseThrow(() -> new InvalidRoleException(key));
    }

    /**
     * Parse a role key from request input, where an unknown role must not throw.
     */
    public static Optional<Role> tryFromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim();
        return Arrays.stream(values())
                .filter(role -> role.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
