package com.example.rbac.authz.model;

import com.example.rbac.authz.exception.InvalidPermissionException;

import java.util.Objects;
import java.util.Optional;

/**
 * Capability to perform an {@link Action} on instances of a {@link Resource}.
 *
 * <p>Canonical string form is {@code "action:resource"}, e.g. {@code "update:projects"}.
 * Both halves are enum values, so every instance is well-formed by construction.
 *
 * @param action   the operation
 * @param resource the protected object class
 */
public record Permission(Action action, Resource resource) implements Comparable<Permission> {

    private static final char SEPARATOR = ':';

    public Permission {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resource, "resource");
    }

    public static Permission of(Action action, Resource resource) {
        return new Permission(action, resource);
    }

    /**
     * Parse a permission string from configuration.
     *
     * @throws InvalidPermissionException if the value is not {@code action:resource} over the enumerations
     */
    public static Permission parse(String value) {
        return tryParse(value).orElseThrow(() -> new InvalidPermissionException(value));
    }

    /**
     * Parse a permission string from request input, where a malformed value must not throw.
     */
    public static Optional<Permission> tryParse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        int idx = trimmed.indexOf(SEPARATOR);
        if (idx <= 0 || idx != trimmed.lastIndexOf(SEPARATOR)) {
            return Optional.empty();
        }
        Optional<Action> action = Action.tryFromKey(trimmed.substring(0, idx));
        Optional<Resource> resource = Resource.tryFromKey(trimmed.substring(idx + 1));
        if (action.isEmpty() || resource.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Permission(action.get(), resource.get()));
    }

    /**
     * Canonical {@code "action:resource"} form.
     */
    public String value() {
        return action.key() + SEPARATOR + resource.key();
    }

    @Override
    public int compareTo(Permission other) {
        return value().compareTo(other.value());
    }

    @Override
    public String toString() {
        return value();
    }
}
