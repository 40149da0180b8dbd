package com.example.rbac.authz.catalog;

import com.example.rbac.authz.exception.InvalidRoleException;
import com.example.rbac.authz.exception.RbacConfigurationException;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Permissions explicitly granted to each role.
 *
 * <p>Immutable once built. Entries are not accumulated across the hierarchy here;
 * see {@link com.example.rbac.authz.resolver.PermissionResolver} for that.
 */
@Slf4j
public final class PermissionCatalog {

    private final Map<Role, Set<Permission>> grants;

    private PermissionCatalog(Map<Role, Set<Permission>> grants) {
        this.grants = grants;
    }

    /**
     * Build a catalog from typed entries.
     */
    public static PermissionCatalog of(Map<Role, Set<Permission>> entries) {
        EnumMap<Role, Set<Permission>> copy = new EnumMap<>(Role.class);
        entries.forEach((role, permissions) ->
                copy.put(role, Collections.unmodifiableSet(new TreeSet<>(permissions))));
        return new PermissionCatalog(Collections.unmodifiableMap(copy));
    }

    /**
     * Build a catalog from configuration, validating every role key and permission string.
     * All problems are collected and reported together.
     *
     * @param entries role key to permission strings
     * @throws RbacConfigurationException if any key or entry is not well-formed
     */
    public static PermissionCatalog fromConfig(Map<String, List<String>> entries) {
        List<String> problems = new ArrayList<>();
        EnumMap<Role, Set<Permission>> parsed = new EnumMap<>(Role.class);

        entries.forEach((roleKey, permissionStrings) -> {
            Optional<Role> role = Role.tryFromKey(roleKey);
            if (role.isEmpty()) {
                problems.add("unknown role '" + roleKey + "'");
                return;
            }
            Set<Permission> permissions = parsed.computeIfAbsent(role.get(), r -> new TreeSet<>());
            if (permissionStrings == null) {
                return;
            }
            for (String value : permissionStrings) {
                Optional<Permission> permission = Permission.tryParse(value);
                if (permission.isEmpty()) {
                    problems.add("role '" + roleKey + "' has malformed permission '" + value + "'");
                } else if (!permissions.add(permission.get())) {
                    log.warn("Duplicate catalog entry {} for role {}", value, roleKey);
                }
            }
        });

        if (!problems.isEmpty()) {
            throw new RbacConfigurationException("Invalid permission catalog", problems);
        }

        for (Role role : Role.values()) {
            if (!parsed.containsKey(role)) {
                log.warn("Role {} has no catalog entry; it inherits lower-ranked grants only", role.key());
            }
        }

        return of(parsed);
    }

    /**
     * Permissions explicitly assigned to the role, not accumulated.
     *
     * @throws InvalidRoleException if {@code role} is null
     */
    public Set<Permission> permissionsForRole(Role role) {
        if (role == null) {
            throw new InvalidRoleException(null);
        }
        return grants.getOrDefault(role, Set.of());
    }

    /**
     * Every permission granted to at least one role.
     */
    public Set<Permission> allPermissions() {
        return grants.values().stream()
                .flatMap(Set::stream)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public boolean isGrantedToAnyRole(Permission permission) {
        return grants.values().stream().anyMatch(set -> set.contains(permission));
    }

    /**
     * Number of role entries.
     */
    public int size() {
        return grants.size();
    }

    @Override
    public String toString() {
        return "PermissionCatalog{" + grants.entrySet().stream()
                .map(e -> e.getKey().key() + "=" + e.getValue().size())
                .collect(Collectors.joining(", ")) + "}";
    }
}
