package com.example.rbac.authz.dto;

import java.util.Set;

/**
 * Effective permissions for the calling subject.
 *
 * @param subjectId   principal identifier
 * @param role        role key, {@code null} when the role was not recognised
 * @param permissions deduplicated {@code "action:resource"} strings
 */
public record PermissionsResponse(
        String subjectId,
        String role,
        Set<String> permissions
) {}
