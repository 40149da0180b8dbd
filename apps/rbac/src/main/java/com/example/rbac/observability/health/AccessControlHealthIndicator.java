package com.example.rbac.observability.health;

import com.example.rbac.authz.catalog.PermissionCatalog;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.predicate.PredicateRegistry;
import com.example.rbac.authz.resolver.PermissionResolver;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports the loaded access-control configuration.
 * DOWN when the most privileged role ends up with no effective permissions.
 */
@Component
public class AccessControlHealthIndicator implements ReactiveHealthIndicator {

    private final PermissionCatalog catalog;
    private final PredicateRegistry predicates;
    private final PermissionResolver resolver;

    public AccessControlHealthIndicator(PermissionCatalog catalog, PredicateRegistry predicates,
                                        PermissionResolver resolver) {
        this.catalog = catalog;
        this.predicates = predicates;
        this.resolver = resolver;
    }

    @Override
    public Mono<Health> health() {
        Role top = Role.values()[Role.values().length - 1];
        int topPermissions = resolver.accumulatedPermissions(top).size();

        Health.Builder builder = topPermissions > 0 ? Health.up() : Health.down();
        return Mono.just(builder
                .withDetail("roles", catalog.size())
                .withDetail("permissions", catalog.allPermissions().size())
                .withDetail("predicates", predicates.size())
                .withDetail(top.key() + "EffectivePermissions", topPermissions)
                .build());
    }
}
