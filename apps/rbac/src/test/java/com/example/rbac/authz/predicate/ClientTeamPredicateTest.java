package com.example.rbac.authz.predicate;

import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import com.example.rbac.util.AccessControlFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.example.rbac.util.SubjectTestBuilder.aSubject;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientTeamPredicate")
class ClientTeamPredicateTest {

    private final ClientTeamPredicate predicate =
            new ClientTeamPredicate(AccessControlFixtures.clientTeams(), AccessControlFixtures.HIERARCHY);

    @Test
    @DisplayName("should gate read:clients")
    void shouldGateReadClients() {
        assertThat(predicate.getPermission()).isEqualTo(Permission.parse("read:clients"));
    }

    @Nested
    @DisplayName("with a client id")
    class WithClientId {

        @Test
        @DisplayName("should allow a member of a serving team")
        void shouldAllowServingTeamMember() {
            Subject dev = aSubject().withRole(Role.DEVELOPER).withTeams("team-gamma").build();

            assertThat(predicate.test(dev, "globex")).isTrue();
        }

        @Test
        @DisplayName("should deny a team member who does not serve that client")
        void shouldDenyOtherTeam() {
            Subject dev = aSubject().withRole(Role.DEVELOPER).withTeams("team-alpha").build();

            assertThat(predicate.test(dev, "globex")).isFalse();
        }

        @Test
        @DisplayName("should deny an unknown client for non-managers")
        void shouldDenyUnknownClient() {
            Subject dev = aSubject().withRole(Role.DEVELOPER).withTeams("team-alpha").build();

            assertThat(predicate.test(dev, "initech")).isFalse();
        }

        @Test
        @DisplayName("should allow managers regardless of teams")
        void shouldAllowManagers() {
            assertThat(predicate.test(aSubject().withRole(Role.MANAGER).build(), "initech")).isTrue();
        }
    }

    @Nested
    @DisplayName("without a client id")
    class WithoutClientId {

        @Test
        @DisplayName("should allow a subject in any team")
        void shouldAllowAnyTeamMember() {
            Subject dev = aSubject().withRole(Role.DEVELOPER).withTeams("team-zeta").build();

            assertThat(predicate.test(dev, null)).isTrue();
        }

        @Test
        @DisplayName("should deny a subject with no team")
        void shouldDenyTeamless() {
            assertThat(predicate.test(aSubject().withRole(Role.DEVELOPER).build(), null)).isFalse();
        }
    }
}
