package com.example.rbac.authz.dto;

public record RoleCheckResponse(
        String role,
        boolean allowed
) {}
