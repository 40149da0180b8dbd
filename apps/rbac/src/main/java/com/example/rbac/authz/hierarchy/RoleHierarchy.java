package com.example.rbac.authz.hierarchy;

import com.example.rbac.authz.exception.InvalidRoleException;
import com.example.rbac.authz.model.Role;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Total order over {@link Role}, least to most privileged.
 *
 * <p>Stateless. Rank comes from the enum declaration order.
 */
@Component
public class RoleHierarchy {

    private static final List<Role> ORDERED = List.of(Role.values());

    /**
     * @throws InvalidRoleException if {@code role} is null
     */
    public int rank(Role role) {
        if (role == null) {
            throw new InvalidRoleException(null);
        }
        return role.rank();
    }

    /**
     * Rank of a role given by its configuration key.
     *
     * @throws InvalidRoleException if the key is not an enumerated role
     */
    public int rank(String roleKey) {
        return rank(Role.fromKey(roleKey));
    }

    /**
     * {@code rank(subjectRole) >= rank(requiredRole)}.
     */
    public boolean isAtLeast(Role subjectRole, Role requiredRole) {
        return rank(subjectRole) >= rank(requiredRole);
    }

    /**
     * Every role with rank {@code <= rank(role)}, least privileged first.
     */
    public List<Role> rolesUpTo(Role role) {
        int max = rank(role);
        return ORDERED.subList(0, max + 1);
    }

    /**
     * All roles, least privileged first.
     */
    public List<Role> ordered() {
        return ORDERED;
    }

    @Override
    public String toString() {
        return "RoleHierarchy" + Arrays.toString(Role.values());
    }
}
