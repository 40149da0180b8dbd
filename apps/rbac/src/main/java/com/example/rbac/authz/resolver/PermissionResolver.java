package com.example.rbac.authz.resolver;

import com.example.rbac.authz.catalog.PermissionCatalog;
import com.example.rbac.authz.hierarchy.RoleHierarchy;
import com.example.rbac.authz.model.AccessDecision;
import com.example.rbac.authz.model.AccessDecision.Reason;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import com.example.rbac.authz.predicate.PermissionPredicate;
import com.example.rbac.authz.predicate.PredicateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether a subject holds a permission, optionally for one resource instance.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>Explicit override: permission in {@code subject.permissions()} grants immediately</li>
 *   <li>Accumulation: union of catalog grants for every role ranked at or below the subject's</li>
 *   <li>Membership: permission not in the accumulated set is denied</li>
 *   <li>Predicate gate: a registered predicate has the final say, otherwise grant</li>
 * </ol>
 *
 * <p>Never throws. Missing or unknown input resolves to a deny. Accumulated sets are
 * computed once at construction, so the resolver holds no mutable state and is safe
 * to call from any number of threads.
 */
@Slf4j
@Component
public class PermissionResolver {

    private final PredicateRegistry predicates;
    private final Map<Role, Set<Permission>> accumulated;

    public PermissionResolver(RoleHierarchy hierarchy, PermissionCatalog catalog, PredicateRegistry predicates) {
        this.predicates = predicates;
        this.accumulated = accumulate(hierarchy, catalog);

        log.info("Permission resolver initialized: {} roles, {} predicates", accumulated.size(), predicates.size());
        accumulated.forEach((role, permissions) ->
                log.debug("  - {} (rank={}): {} effective permissions", role.key(), role.rank(), permissions.size()));
    }

    /**
     * Resolve the permission and report which step decided it.
     */
    public AccessDecision resolve(@Nullable Subject subject, @Nullable Permission permission,
                                  @Nullable String resourceId) {
        AccessDecision membership = checkMembership(subject, permission);
        if (membership != null) {
            return membership;
        }

        Optional<AccessDecision> gated = applyPredicate(subject, permission, resourceId);
        if (gated.isPresent() && gated.get().isDenied()) {
            return gated.get();
        }

        if (predicates.asyncPredicateFor(permission).isPresent()) {
            // fail closed: the asynchronous gate cannot run on this path
            return AccessDecision.deny(Reason.PREDICATE_DENY, permission,
                    String.format("%s requires asynchronous evaluation", permission));
        }

        return gated.orElseGet(() -> AccessDecision.grant(Reason.ROLE_GRANT, permission,
                String.format("Role %s grants %s", subject.role().key(), permission)));
    }

    /**
     * Convenience boolean form of {@link #resolve}.
     */
    public boolean hasPermission(@Nullable Subject subject, @Nullable Permission permission,
                                 @Nullable String resourceId) {
        AccessDecision decision = resolve(subject, permission, resourceId);
        if (log.isDebugEnabled()) {
            log.debug("{} {} on {}: {}", decision.isGranted() ? "GRANT" : "DENY", permission,
                    resourceId != null ? resourceId : "*", decision.detail());
        }
        return decision.isGranted();
    }

    /**
     * Union of catalog grants for the role and every lower-ranked role.
     * Empty for a {@code null} role.
     */
    public Set<Permission> accumulatedPermissions(@Nullable Role role) {
        if (role == null) {
            return Set.of();
        }
        return accumulated.getOrDefault(role, Set.of());
    }

    /**
     * Steps 1 to 3. Returns the final decision when the override grants or membership denies,
     * {@code null} when the accumulated role set contains the permission and a predicate
     * may still apply.
     */
    @Nullable
    AccessDecision checkMembership(@Nullable Subject subject, @Nullable Permission permission) {
        if (subject == null || permission == null) {
            return AccessDecision.deny(Reason.INVALID_REQUEST, permission, "Subject or permission missing");
        }

        if (subject.hasExplicitPermission(permission)) {
            return AccessDecision.grant(Reason.EXPLICIT_OVERRIDE, permission,
                    String.format("Subject %s holds %s as an explicit override", subject.id(), permission));
        }

        if (subject.role() == null) {
            return AccessDecision.deny(Reason.INVALID_REQUEST, permission,
                    String.format("Subject %s has no recognised role", subject.id()));
        }

        if (!accumulatedPermissions(subject.role()).contains(permission)) {
            return AccessDecision.deny(Reason.NOT_GRANTED, permission,
                    String.format("Role %s does not grant %s", subject.role().key(), permission));
        }

        return null;
    }

    /**
     * Step 4 for the synchronous predicate, empty when none is registered.
     * A throwing predicate is logged and reported as {@link Reason#PREDICATE_ERROR}.
     */
    Optional<AccessDecision> applyPredicate(Subject subject, Permission permission, @Nullable String resourceId) {
        Optional<PermissionPredicate> registered = predicates.predicateFor(permission);
        if (registered.isEmpty()) {
            return Optional.empty();
        }
        PermissionPredicate predicate = registered.get();

        boolean passed;
        try {
            passed = predicate.test(subject, resourceId);
        } catch (RuntimeException e) {
            log.error("Predicate for {} threw for subject {} (resource={}); treating as deny",
                    permission, subject.id(), resourceId, e);
            return Optional.of(AccessDecision.deny(Reason.PREDICATE_ERROR, permission,
                    "Predicate failed: " + e.getMessage()));
        }

        if (passed) {
            return Optional.of(AccessDecision.grant(Reason.PREDICATE_GRANT, permission, predicate.getDescription()));
        }
        return Optional.of(AccessDecision.deny(Reason.PREDICATE_DENY, permission, predicate.getDescription()));
    }

    private static Map<Role, Set<Permission>> accumulate(RoleHierarchy hierarchy, PermissionCatalog catalog) {
        EnumMap<Role, Set<Permission>> result = new EnumMap<>(Role.class);
        Set<Permission> running = new TreeSet<>();
        for (Role role : hierarchy.ordered()) {
            running.addAll(catalog.permissionsForRole(role));
            result.put(role, Collections.unmodifiableSet(new TreeSet<>(running)));
        }
        return Collections.unmodifiableMap(result);
    }
}
