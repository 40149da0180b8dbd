package com.example.rbac.authz.controller;

import com.example.rbac.authz.dto.CapabilityCheckResponse;
import com.example.rbac.authz.dto.PermissionsResponse;
import com.example.rbac.authz.dto.RoleCheckResponse;
import com.example.rbac.authz.model.Action;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Resource;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import com.example.rbac.authz.resolver.ReactivePermissionResolver;
import com.example.rbac.authz.service.CapabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Capability queries for UI conditional rendering.
 *
 * <p>Advisory only: these endpoints answer questions, they do not guard other routes.
 * Unknown roles, resources or actions answer {@code allowed=false} rather than an error.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/capabilities")
@RequiredArgsConstructor
public class CapabilityController {

    private final CapabilityService capabilityService;
    private final ReactivePermissionResolver reactiveResolver;
    private final SubjectHeaderResolver subjectResolver;

    @GetMapping("/permissions")
    public Mono<ResponseEntity<PermissionsResponse>> getPermissions(ServerWebExchange exchange) {
        Subject subject = subjectResolver.resolve(exchange.getRequest());
        PermissionsResponse body = new PermissionsResponse(
                subject.id(),
                subject.role() != null ? subject.role().key() : null,
                capabilityService.getUserPermissions(subject));
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/check")
    public Mono<ResponseEntity<CapabilityCheckResponse>> check(
            @RequestParam String resource,
            @RequestParam String action,
            @RequestParam(required = false) String resourceId,
            ServerWebExchange exchange) {

        Subject subject = subjectResolver.resolve(exchange.getRequest());
        Optional<Resource> parsedResource = Resource.tryFromKey(resource);
        Optional<Action> parsedAction = Action.tryFromKey(action);

        if (parsedResource.isEmpty() || parsedAction.isEmpty()) {
            log.debug("Unknown capability {}:{} requested by {}", action, resource, subject.id());
            return Mono.just(ResponseEntity.ok(
                    new CapabilityCheckResponse(action + ":" + resource, resourceId, false)));
        }

        Permission permission = Permission.of(parsedAction.get(), parsedResource.get());
        return reactiveResolver.hasPermission(subject, permission, resourceId)
                .map(allowed -> ResponseEntity.ok(
                        new CapabilityCheckResponse(permission.value(), resourceId, allowed)));
    }

    @GetMapping("/roles/{role}")
    public Mono<ResponseEntity<RoleCheckResponse>> checkRole(@PathVariable String role, ServerWebExchange exchange) {
        Subject subject = subjectResolver.resolve(exchange.getRequest());
        boolean allowed = Role.tryFromKey(role)
                .map(required -> capabilityService.hasRole(subject, required))
                .orElse(false);
        return Mono.just(ResponseEntity.ok(new RoleCheckResponse(role, allowed)));
    }
}
