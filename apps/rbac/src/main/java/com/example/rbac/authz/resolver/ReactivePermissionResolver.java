package com.example.rbac.authz.resolver;

import com.example.rbac.authz.config.RbacProperties;
import com.example.rbac.authz.model.AccessDecision;
import com.example.rbac.authz.model.AccessDecision.Reason;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Subject;
import com.example.rbac.authz.predicate.AsyncPermissionPredicate;
import com.example.rbac.authz.predicate.PredicateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Non-blocking variant of {@link PermissionResolver} for permissions gated by an
 * {@link AsyncPermissionPredicate}.
 *
 * <p>Steps 1 to 3 and any synchronous predicate run exactly as in {@link PermissionResolver}.
 * The asynchronous predicate runs last and is bounded by {@code rbac.async.timeout}.
 * Error, timeout or empty completion all deny.
 */
@Slf4j
@Component
public class ReactivePermissionResolver {

    private final PermissionResolver resolver;
    private final PredicateRegistry predicates;
    private final Duration timeout;

    public ReactivePermissionResolver(PermissionResolver resolver, PredicateRegistry predicates,
                                      RbacProperties properties) {
        this.resolver = resolver;
        this.predicates = predicates;
        this.timeout = properties.async().timeout();
    }

    public Mono<AccessDecision> resolve(@Nullable Subject subject, @Nullable Permission permission,
                                        @Nullable String resourceId) {
        AccessDecision membership = resolver.checkMembership(subject, permission);
        if (membership != null) {
            return Mono.just(membership);
        }

        Optional<AccessDecision> gated = resolver.applyPredicate(subject, permission, resourceId);
        if (gated.isPresent() && gated.get().isDenied()) {
            return Mono.just(gated.get());
        }

        Optional<AsyncPermissionPredicate> async = predicates.asyncPredicateFor(permission);
        if (async.isEmpty()) {
            return Mono.just(gated.orElseGet(() -> AccessDecision.grant(Reason.ROLE_GRANT, permission,
                    String.format("Role %s grants %s", subject.role().key(), permission))));
        }

        return evaluateAsync(async.get(), subject, permission, resourceId);
    }

    public Mono<Boolean> hasPermission(@Nullable Subject subject, @Nullable Permission permission,
                                       @Nullable String resourceId) {
        return resolve(subject, permission, resourceId).map(AccessDecision::isGranted);
    }

    private Mono<AccessDecision> evaluateAsync(AsyncPermissionPredicate predicate, Subject subject,
                                               Permission permission, @Nullable String resourceId) {
        Mono<Boolean> result;
        try {
            result = predicate.test(subject, resourceId);
        } catch (RuntimeException e) {
            result = Mono.error(e);
        }
        if (result == null) {
            result = Mono.empty();
        }

        return result
                .timeout(timeout)
                .map(passed -> passed
                        ? AccessDecision.grant(Reason.PREDICATE_GRANT, permission, predicate.getDescription())
                        : AccessDecision.deny(Reason.PREDICATE_DENY, permission, predicate.getDescription()))
                .switchIfEmpty(Mono.fromSupplier(() -> AccessDecision.deny(Reason.PREDICATE_DENY, permission,
                        "Async predicate completed without a result")))
                .onErrorResume(error -> {
                    log.error("Async predicate for {} failed for subject {} (resource={}); treating as deny",
                            permission, subject.id(), resourceId, error);
                    return Mono.just(AccessDecision.deny(Reason.PREDICATE_ERROR, permission,
                            "Async predicate failed: " + error.getMessage()));
                });
    }
}
