package com.example.rbac.authz.model;

import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The authenticated principal under evaluation.
 *
 * <p>Created by the session provider per request and never mutated by the engine.
 * A {@code null} role means the provider could not map the principal onto the hierarchy;
 * every check against such a subject is denied.
 *
 * @param id          principal identifier
 * @param role        assigned role, or {@code null} when unknown
 * @param permissions explicit overrides granted independently of the role
 * @param teams       team memberships consulted by predicates
 */
public record Subject(
        String id,
        @Nullable Role role,
        Set<Permission> permissions,
        Set<String> teams
) {
    public Subject {
        permissions = immutableCopy(permissions);
        teams = immutableCopy(teams);
    }

    /**
     * Check if the permission was granted to this subject directly.
     */
    public boolean hasExplicitPermission(Permission permission) {
        return permission != null && permissions.contains(permission);
    }

    public boolean belongsToAnyTeam() {
        return !teams.isEmpty();
    }

    /**
     * Check if the subject shares at least one team with the given set.
     */
    public boolean sharesTeamWith(Collection<String> otherTeams) {
        if (otherTeams == null || otherTeams.isEmpty()) {
            return false;
        }
        return otherTeams.stream().anyMatch(teams::contains);
    }

    private static <T> Set<T> immutableCopy(Set<T> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(source.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toSet()));
    }
}
