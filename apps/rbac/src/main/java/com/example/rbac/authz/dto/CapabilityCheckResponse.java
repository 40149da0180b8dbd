package com.example.rbac.authz.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CapabilityCheckResponse(
        String permission,
        String resourceId,
        boolean allowed
) {}
