package com.example.rbac.authz.predicate;

import com.example.rbac.authz.catalog.PermissionCatalog;
import com.example.rbac.authz.exception.RbacConfigurationException;
import com.example.rbac.authz.model.Permission;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable table of permission to predicate, built once at startup.
 *
 * <p>At most one synchronous and one asynchronous predicate per permission.
 */
@Slf4j
public final class PredicateRegistry {

    private final Map<Permission, PermissionPredicate> predicates;
    private final Map<Permission, AsyncPermissionPredicate> asyncPredicates;

    private PredicateRegistry(Map<Permission, PermissionPredicate> predicates,
                              Map<Permission, AsyncPermissionPredicate> asyncPredicates) {
        this.predicates = predicates;
        this.asyncPredicates = asyncPredicates;
    }

    public static PredicateRegistry of(Collection<? extends PermissionPredicate> predicates) {
        return of(predicates, List.of());
    }

    /**
     * @throws RbacConfigurationException if two predicates of the same kind target one permission
     */
    public static PredicateRegistry of(Collection<? extends PermissionPredicate> predicates,
                                       Collection<? extends AsyncPermissionPredicate> asyncPredicates) {
        List<String> problems = new ArrayList<>();

        Map<Permission, PermissionPredicate> sync = new TreeMap<>();
        for (PermissionPredicate predicate : predicates) {
            PermissionPredicate existing = sync.putIfAbsent(predicate.getPermission(), predicate);
            if (existing != null) {
                problems.add("duplicate predicate for " + predicate.getPermission()
                        + " (" + existing.getDescription() + " / " + predicate.getDescription() + ")");
            }
        }

        Map<Permission, AsyncPermissionPredicate> async = new TreeMap<>();
        for (AsyncPermissionPredicate predicate : asyncPredicates) {
            AsyncPermissionPredicate existing = async.putIfAbsent(predicate.getPermission(), predicate);
            if (existing != null) {
                problems.add("duplicate async predicate for " + predicate.getPermission());
            }
        }

        if (!problems.isEmpty()) {
            throw new RbacConfigurationException("Invalid predicate table", problems);
        }

        return new PredicateRegistry(Collections.unmodifiableMap(sync), Collections.unmodifiableMap(async));
    }

    public static PredicateRegistry empty() {
        return new PredicateRegistry(Map.of(), Map.of());
    }

    public Optional<PermissionPredicate> predicateFor(Permission permission) {
        return Optional.ofNullable(predicates.get(permission));
    }

    public Optional<AsyncPermissionPredicate> asyncPredicateFor(Permission permission) {
        return Optional.ofNullable(asyncPredicates.get(permission));
    }

    /**
     * Warn about predicates that can never fire because no role is granted their permission.
     */
    public void validateAgainst(PermissionCatalog catalog) {
        predicates.keySet().stream()
                .filter(p -> !catalog.isGrantedToAnyRole(p))
                .forEach(p -> log.warn("Predicate for {} is unreachable: no role is granted this permission", p));
        asyncPredicates.keySet().stream()
                .filter(p -> !catalog.isGrantedToAnyRole(p))
                .forEach(p -> log.warn("Async predicate for {} is unreachable: no role is granted this permission", p));
    }

    public Collection<PermissionPredicate> getPredicates() {
        return predicates.values();
    }

    public int size() {
        return predicates.size() + asyncPredicates.size();
    }
}
