package com.example.rbac.authz.predicate;

import com.example.rbac.authz.config.RbacProperties.PredicateDefinition;
import com.example.rbac.authz.exception.RbacConfigurationException;
import com.example.rbac.authz.hierarchy.RoleHierarchy;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import org.springframework.lang.Nullable;

/**
 * Rule-based predicate built from a {@code rbac.predicates} entry.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>{@code minimum-role}: subject rank must be at least this role</li>
 *   <li>{@code require-resource-id}: a resource instance must be supplied, unless the
 *       subject is at least {@code bypass-role}</li>
 * </ol>
 */
public class ConfiguredPermissionPredicate implements PermissionPredicate {

    private final Permission permission;
    private final String description;
    @Nullable
    private final Role minimumRole;
    private final boolean requireResourceId;
    @Nullable
    private final Role bypassRole;
    private final RoleHierarchy hierarchy;

    public ConfiguredPermissionPredicate(PredicateDefinition definition, RoleHierarchy hierarchy) {
        this.permission = Permission.parse(definition.permission());
        this.description = isBlank(definition.description())
                ? "Configured rule for " + permission
                : definition.description();
        this.minimumRole = optionalRole(definition.minimumRole());
        this.requireResourceId = definition.requireResourceId();
        this.bypassRole = optionalRole(definition.bypassRole());
        this.hierarchy = hierarchy;

        if (minimumRole == null && !requireResourceId) {
            throw new RbacConfigurationException(
                    "Predicate for " + permission + " declares no rule (minimum-role or require-resource-id)");
        }
        if (bypassRole != null && !requireResourceId) {
            throw new RbacConfigurationException(
                    "Predicate for " + permission + " sets bypass-role without require-resource-id");
        }
    }

    @Override
    public Permission getPermission() {
        return permission;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean test(Subject subject, @Nullable String resourceId) {
        Role role = subject.role();
        if (role == null) {
            return false;
        }

        if (minimumRole != null && !hierarchy.isAtLeast(role, minimumRole)) {
            return false;
        }

        if (requireResourceId && isBlank(resourceId)) {
            return bypassRole != null && hierarchy.isAtLeast(role, bypassRole);
        }

        return true;
    }

    private static Role optionalRole(String key) {
        return key == null || key.isBlank() ? null : Role.fromKey(key);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return "ConfiguredPermissionPredicate{" + permission + ": " + description + "}";
    }
}
