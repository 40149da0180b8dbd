package com.example.rbac.authz.service;

import com.example.rbac.authz.hierarchy.RoleHierarchy;
import com.example.rbac.authz.model.Action;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Resource;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import com.example.rbac.authz.resolver.PermissionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Public capability queries used by controllers and UI-facing code.
 *
 * <p>Deny-by-default: a missing subject, unknown role or malformed permission string
 * yields {@code false} (or an empty set), never an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapabilityService {

    private final PermissionResolver resolver;
    private final RoleHierarchy hierarchy;

    public boolean hasPermission(@Nullable Subject subject, @Nullable Permission permission) {
        return hasPermission(subject, permission, null);
    }

    public boolean hasPermission(@Nullable Subject subject, @Nullable Permission permission,
                                 @Nullable String resourceId) {
        return resolver.hasPermission(subject, permission, resourceId);
    }

    /**
     * Check a permission given in its {@code "action:resource"} form.
     */
    public boolean hasPermission(@Nullable Subject subject, @Nullable String permission) {
        return hasPermission(subject, permission, null);
    }

    public boolean hasPermission(@Nullable Subject subject, @Nullable String permission,
                                 @Nullable String resourceId) {
        Optional<Permission> parsed = Permission.tryParse(permission);
        if (parsed.isEmpty()) {
            log.debug("Denying malformed permission '{}'", permission);
            return false;
        }
        return hasPermission(subject, parsed.get(), resourceId);
    }

    public boolean canAccess(@Nullable Subject subject, @Nullable Resource resource, @Nullable Action action) {
        return canAccess(subject, resource, action, null);
    }

    /**
     * Equivalent to {@code hasPermission(subject, action:resource, resourceId)}.
     */
    public boolean canAccess(@Nullable Subject subject, @Nullable Resource resource, @Nullable Action action,
                             @Nullable String resourceId) {
        if (resource == null || action == null) {
            return false;
        }
        return hasPermission(subject, Permission.of(action, resource), resourceId);
    }

    /**
     * True when the subject's role ranks at or above {@code role}. Reflexive.
     */
    public boolean hasRole(@Nullable Subject subject, @Nullable Role role) {
        if (subject == null || subject.role() == null || role == null) {
            return false;
        }
        return hierarchy.isAtLeast(subject.role(), role);
    }

    public boolean hasAnyPermission(@Nullable Subject subject, @Nullable Collection<Permission> permissions) {
        if (permissions == null || permissions.isEmpty()) {
            return false;
        }
        return permissions.stream().anyMatch(p -> hasPermission(subject, p));
    }

    /**
     * True only if every permission is granted. An empty collection is not a grant.
     */
    public boolean hasAllPermissions(@Nullable Subject subject, @Nullable Collection<Permission> permissions) {
        if (permissions == null || permissions.isEmpty()) {
            return false;
        }
        return permissions.stream().allMatch(p -> hasPermission(subject, p));
    }

    /**
     * Accumulated role permissions plus explicit overrides, deduplicated.
     * Predicates are not applied; this is the coarse capability list.
     */
    public Set<Permission> getEffectivePermissions(@Nullable Subject subject) {
        if (subject == null) {
            return Set.of();
        }
        Set<Permission> effective = new TreeSet<>(resolver.accumulatedPermissions(subject.role()));
        effective.addAll(subject.permissions());
        return Collections.unmodifiableSet(effective);
    }

    /**
     * {@link #getEffectivePermissions} in {@code "action:resource"} form, sorted.
     */
    public Set<String> getUserPermissions(@Nullable Subject subject) {
        return getEffectivePermissions(subject).stream()
                .map(Permission::value)
                .collect(Collectors.collectingAndThen(Collectors.toCollection(TreeSet::new),
                        Collections::unmodifiableSet));
    }
}
