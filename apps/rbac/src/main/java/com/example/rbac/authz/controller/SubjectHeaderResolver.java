package com.example.rbac.authz.controller;

import com.example.rbac.authz.config.RbacProperties;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Subject} from the identity headers set by the upstream session provider.
 *
 * <p>Lenient by contract: an unknown role yields a subject without a role, and malformed
 * permission overrides are dropped, so every check against bad input denies.
 */
@Slf4j
@Component
public class SubjectHeaderResolver {

    private static final String ANONYMOUS = "anonymous";

    private final RbacProperties.SubjectHeaders headers;

    public SubjectHeaderResolver(RbacProperties properties) {
        this.headers = properties.subjectHeaders();
    }

    public Subject resolve(ServerHttpRequest request) {
        HttpHeaders http = request.getHeaders();

        String userId = http.getFirst(headers.userId());
        if (userId == null || userId.isBlank()) {
            userId = ANONYMOUS;
        }

        String roleValue = http.getFirst(headers.role());
        Optional<Role> role = Role.tryFromKey(roleValue);
        if (role.isEmpty() && roleValue != null) {
            log.warn("Unrecognised role '{}' for subject {}; all checks will deny", roleValue, userId);
        }

        Set<Permission> overrides = new HashSet<>();
        for (String value : splitList(http.getFirst(headers.permissions()))) {
            Optional<Permission> permission = Permission.tryParse(value);
            if (permission.isPresent()) {
                overrides.add(permission.get());
            } else {
                log.warn("Dropping malformed permission override '{}' for subject {}", value, userId);
            }
        }

        Set<String> teams = splitList(http.getFirst(headers.teams()));

        log.debug("Resolved subject: id={}, role={}, overrides={}, teams={}",
                userId, role.map(Role::key).orElse(null), overrides.size(), teams.size());

        return new Subject(userId, role.orElse(null), overrides, teams);
    }

    private static Set<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }
}
