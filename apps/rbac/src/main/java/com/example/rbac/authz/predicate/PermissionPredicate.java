package com.example.rbac.authz.predicate;

import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Subject;
import org.springframework.lang.Nullable;

/**
 * Instance-level refinement of one catalog permission.
 *
 * <p>Consulted only after the subject's role already grants {@link #getPermission()}, so a
 * predicate can narrow a grant but never widen it.
 *
 * <p>Implementations must be pure and total: no I/O, no shared mutable state, and a
 * deterministic answer for every input including a {@code null} resource id. Predicates that
 * need I/O belong in {@link AsyncPermissionPredicate} instead.
 *
 * <p>Spring beans implementing this interface are registered automatically.
 */
public interface PermissionPredicate {

    /**
     * The permission this predicate gates.
     */
    Permission getPermission();

    /**
     * Human-readable description of the rule.
     */
    String getDescription();

    /**
     * @param subject    the principal, always with a non-null role
     * @param resourceId the resource instance, or {@code null} for a class-wide check
     * @return true to keep the grant, false to deny
     */
    boolean test(Subject subject, @Nullable String resourceId);
}
