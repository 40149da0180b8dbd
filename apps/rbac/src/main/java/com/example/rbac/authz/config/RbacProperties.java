package com.example.rbac.authz.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Role catalog, predicate table and request-binding settings.
 * Loaded from the {@code rbac} section of application.yml.
 */
@Validated
@ConfigurationProperties(prefix = "rbac")
public record RbacProperties(
        Map<String, List<String>> catalog,
        @Valid List<PredicateDefinition> predicates,
        Map<String, List<String>> clientTeams,
        SubjectHeaders subjectHeaders,
        AsyncProperties async
) {
    public RbacProperties {
        if (catalog == null) {
            catalog = Map.of();
        }
        if (predicates == null) {
            predicates = List.of();
        }
        if (clientTeams == null) {
            clientTeams = Map.of();
        }
        if (subjectHeaders == null) {
            subjectHeaders = new SubjectHeaders(null, null, null, null);
        }
        if (async == null) {
            async = new AsyncProperties(null);
        }
    }

    /**
     * Rule-based predicate declared in configuration.
     *
     * @param permission        the {@code action:resource} the predicate gates
     * @param description       what the rule enforces
     * @param minimumRole       subject must be at least this role, if set
     * @param requireResourceId deny when the check carries no resource instance
     * @param bypassRole        subjects at or above this role skip the resource id requirement
     */
    public record PredicateDefinition(
            @NotBlank String permission,
            String description,
            String minimumRole,
            boolean requireResourceId,
            String bypassRole
    ) {
        public PredicateDefinition {
            if (description == null || description.isBlank()) {
                description = "Configured predicate for " + permission;
            }
        }
    }

    /**
     * Request headers populated by the upstream session provider.
     */
    public record SubjectHeaders(
            String userId,
            String role,
            String permissions,
            String teams
    ) {
        public SubjectHeaders {
            if (userId == null || userId.isBlank()) {
                userId = "X-User-Id";
            }
            if (role == null || role.isBlank()) {
                role = "X-User-Role";
            }
            if (permissions == null || permissions.isBlank()) {
                permissions = "X-User-Permissions";
            }
            if (teams == null || teams.isBlank()) {
                teams = "X-User-Teams";
            }
        }
    }

    public record AsyncProperties(
            Duration timeout
    ) {
        public AsyncProperties {
            if (timeout == null) {
                timeout = Duration.ofSeconds(2);
            }
        }
    }
}
