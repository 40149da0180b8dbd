package com.example.rbac.authz.predicate;

import com.example.rbac.authz.hierarchy.RoleHierarchy;
import com.example.rbac.authz.model.Action;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Resource;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Predicate: reading a client requires serving it.
 *
 * <p>Rule: ALLOW read:clients WHERE
 *   subject.role >= manager OR
 *   (resourceId given AND subject.teams ∩ directory.teamsFor(resourceId) ≠ ∅) OR
 *   (no resourceId AND subject belongs to any team)
 *
 * <p>The no-id branch covers the client list view, which is later filtered per row
 * by calling again with each client id.
 */
@Component
public class ClientTeamPredicate implements PermissionPredicate {

    private static final Permission READ_CLIENTS = Permission.of(Action.READ, Resource.CLIENTS);

    private final ClientTeamDirectory directory;
    private final RoleHierarchy hierarchy;

    public ClientTeamPredicate(ClientTeamDirectory directory, RoleHierarchy hierarchy) {
        this.directory = directory;
        this.hierarchy = hierarchy;
    }

    @Override
    public Permission getPermission() {
        return READ_CLIENTS;
    }

    @Override
    public String getDescription() {
        return "Managers read every client; others only clients served by one of their teams";
    }

    @Override
    public boolean test(Subject subject, @Nullable String resourceId) {
        if (subject.role() == null) {
            return false;
        }
        if (hierarchy.isAtLeast(subject.role(), Role.MANAGER)) {
            return true;
        }
        if (resourceId == null || resourceId.isBlank()) {
            return subject.belongsToAnyTeam();
        }
        return subject.sharesTeamWith(directory.teamsFor(resourceId));
    }
}
