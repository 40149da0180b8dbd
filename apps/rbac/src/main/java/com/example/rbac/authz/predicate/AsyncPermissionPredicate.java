package com.example.rbac.authz.predicate;

import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Subject;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Predicate that needs I/O, e.g. a remote team-membership lookup.
 *
 * <p>Only evaluated by {@link com.example.rbac.authz.resolver.ReactivePermissionResolver}.
 * A permission gated this way is always denied by the synchronous resolver. When a
 * {@link PermissionPredicate} is registered for the same permission, both must pass.
 */
public interface AsyncPermissionPredicate {

    Permission getPermission();

    String getDescription();

    /**
     * Emit true to keep the grant. Errors, timeouts and empty completion all deny.
     */
    Mono<Boolean> test(Subject subject, @Nullable String resourceId);
}
