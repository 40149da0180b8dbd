package com.example.rbac.authz.service;

import com.example.rbac.authz.model.Action;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Resource;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Capability-gated conditional rendering.
 *
 * <p>Three gate modes, matching the capability queries: a permission, a resource and action pair,
 * or a minimum role. Each {@code renderIf*} has a {@code renderUnless*} inverse for content shown
 * only to subjects who lack the capability.
 *
 * <pre>
 * gate.renderIf(subject, Resource.AUTOMATION, Action.CREATE, null, () -> newAutomationButton())
 *     .ifPresent(view::add);
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class CapabilityGate {

    private final CapabilityService capabilityService;

    /**
     * Produce the element only when access is granted. The supplier is not invoked otherwise.
     */
    public <T> Optional<T> renderIf(@Nullable Subject subject, Resource resource, Action action,
                                    @Nullable String resourceId, Supplier<T> content) {
        return render(capabilityService.canAccess(subject, resource, action, resourceId), content);
    }

    public <T> Optional<T> renderIfPermitted(@Nullable Subject subject, Permission permission,
                                             @Nullable String resourceId, Supplier<T> content) {
        return render(capabilityService.hasPermission(subject, permission, resourceId), content);
    }

    public <T> Optional<T> renderIfRole(@Nullable Subject subject, Role role, Supplier<T> content) {
        return render(capabilityService.hasRole(subject, role), content);
    }

    /**
     * Produce the element only when access is denied.
     */
    public <T> Optional<T> renderUnless(@Nullable Subject subject, Resource resource, Action action,
                                        @Nullable String resourceId, Supplier<T> content) {
        return render(!capabilityService.canAccess(subject, resource, action, resourceId), content);
    }

    public <T> Optional<T> renderUnlessPermitted(@Nullable Subject subject, Permission permission,
                                                 @Nullable String resourceId, Supplier<T> content) {
        return render(!capabilityService.hasPermission(subject, permission, resourceId), content);
    }

    public <T> Optional<T> renderUnlessRole(@Nullable Subject subject, Role role, Supplier<T> content) {
        return render(!capabilityService.hasRole(subject, role), content);
    }

    /**
     * Produce the element when access is granted, otherwise the fallback.
     */
    public <T> T renderOrElse(@Nullable Subject subject, Resource resource, Action action,
                              @Nullable String resourceId, Supplier<T> content, Supplier<T> fallback) {
        return renderIf(subject, resource, action, resourceId, content).orElseGet(fallback);
    }

    private static <T> Optional<T> render(boolean show, Supplier<T> content) {
        return show ? Optional.ofNullable(content.get()) : Optional.empty();
    }
}
