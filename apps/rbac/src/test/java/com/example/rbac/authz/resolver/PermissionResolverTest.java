package com.example.rbac.authz.resolver;

import com.example.rbac.authz.catalog.PermissionCatalog;
import com.example.rbac.authz.model.AccessDecision;
import com.example.rbac.authz.model.AccessDecision.Reason;
import com.example.rbac.authz.model.Permission;
import com.example.rbac.authz.model.Role;
import com.example.rbac.authz.model.Subject;
import com.example.rbac.authz.predicate.PermissionPredicate;
import com.example.rbac.authz.predicate.PredicateRegistry;
import com.example.rbac.util.AccessControlFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.rbac.util.SubjectTestBuilder.aClient;
import static com.example.rbac.util.SubjectTestBuilder.aDeveloper;
import static com.example.rbac.util.SubjectTestBuilder.aGuest;
import static com.example.rbac.util.SubjectTestBuilder.aManager;
import static com.example.rbac.util.SubjectTestBuilder.aSubject;
import static com.example.rbac.util.SubjectTestBuilder.anAdmin;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionResolver")
class PermissionResolverTest {

    private final PermissionResolver resolver = AccessControlFixtures.resolver();

    private static Permission p(String value) {
        return Permission.parse(value);
    }

    @Nested
    @DisplayName("Resolution scenarios")
    class Scenarios {

        @Test
        @DisplayName("guest can read projects")
        void guestReadsProjects() {
            assertThat(resolver.hasPermission(aGuest(), p("read:projects"), null)).isTrue();
        }

        @Test
        @DisplayName("guest cannot update projects")
        void guestCannotUpdateProjects() {
            AccessDecision decision = resolver.resolve(aGuest(), p("update:projects"), null);

            assertThat(decision.isGranted()).isFalse();
            assertThat(decision.reason()).isEqualTo(Reason.NOT_GRANTED);
        }

        @Test
        @DisplayName("client can update tasks from its own catalog entry")
        void clientUpdatesTasks() {
            AccessDecision decision = resolver.resolve(aClient(), p("update:tasks"), null);

            assertThat(decision.isGranted()).isTrue();
            assertThat(decision.reason()).isEqualTo(Reason.ROLE_GRANT);
        }

        @Test
        @DisplayName("developer may update projects and client may not")
        void updateProjectsSeparatesDeveloperFromClient() {
            AccessDecision developer = resolver.resolve(aDeveloper(), p("update:projects"), "p-1");
            AccessDecision client = resolver.resolve(aClient(), p("update:projects"), "p-1");

            assertThat(developer.isGranted()).isTrue();
            assertThat(developer.reason()).isEqualTo(Reason.PREDICATE_GRANT);
            assertThat(client.isGranted()).isFalse();
            assertThat(client.reason()).isEqualTo(Reason.NOT_GRANTED);
        }

        @Test
        @DisplayName("predicate can deny a permission the role holds")
        void predicateDeniesCatalogGrant() {
            AccessDecision classWide = resolver.resolve(aManager(), p("export:reports"), null);
            AccessDecision single = resolver.resolve(aManager(), p("export:reports"), "report-9");

            assertThat(classWide.isGranted()).isFalse();
            assertThat(classWide.reason()).isEqualTo(Reason.PREDICATE_DENY);
            assertThat(single.isGranted()).isTrue();
            assertThat(resolver.hasPermission(anAdmin(), p("export:reports"), null)).isTrue();
        }

        @Test
        @DisplayName("explicit override grants a permission the catalog never gives the role")
        void overrideGrants() {
            Subject guest = aSubject().withRole(Role.GUEST).withPermissions("configure:ai_insights").build();

            AccessDecision decision = resolver.resolve(guest, p("configure:ai_insights"), null);

            assertThat(decision.isGranted()).isTrue();
            assertThat(decision.reason()).isEqualTo(Reason.EXPLICIT_OVERRIDE);
        }
    }

    @Nested
    @DisplayName("Accumulation")
    class Accumulation {

        @Test
        @DisplayName("should inherit every lower role's grants")
        void shouldInheritLowerRoles() {
            assertThat(resolver.accumulatedPermissions(Role.DEVELOPER))
                    .contains(p("read:projects"), p("update:tasks"), p("approve:projects"), p("read:clients"))
                    .doesNotContain(p("read:users"), p("delete:projects"));
        }

        @Test
        @DisplayName("should give admin the whole catalog")
        void adminHasEverything() {
            assertThat(resolver.accumulatedPermissions(Role.ADMIN))
                    .containsExactlyInAnyOrderElementsOf(AccessControlFixtures.catalog().allPermissions());
        }

        @ParameterizedTest
        @EnumSource(Role.class)
        @DisplayName("should be monotonic in rank")
        void shouldBeMonotonic(Role role) {
            for (Role lower : Role.values()) {
                if (lower.rank() <= role.rank()) {
                    assertThat(resolver.accumulatedPermissions(role))
                            .containsAll(resolver.accumulatedPermissions(lower));
                }
            }
        }

        @Test
        @DisplayName("should keep a higher role at least as capable under any catalog")
        void shouldStayMonotonicForAnotherCatalog() {
            Map<String, List<String>> entries = new LinkedHashMap<>();
            entries.put("client", List.of("read:billing"));
            entries.put("admin", List.of("configure:settings"));
            PermissionResolver sparse = new PermissionResolver(
                    AccessControlFixtures.HIERARCHY, PermissionCatalog.fromConfig(entries), PredicateRegistry.empty());

            assertThat(sparse.hasPermission(aSubject().withRole(Role.MANAGER).build(), p("read:billing"), null))
                    .isTrue();
            assertThat(sparse.hasPermission(aGuest(), p("read:billing"), null)).isFalse();
            assertThat(sparse.accumulatedPermissions(Role.GUEST)).isEmpty();
        }

        @Test
        @DisplayName("should return an empty set for a missing role")
        void emptyForNullRole() {
            assertThat(resolver.accumulatedPermissions(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Deny by default")
    class DenyByDefault {

        @Test
        @DisplayName("should deny a subject without a role")
        void shouldDenyRoleless() {
            AccessDecision decision = resolver.resolve(aSubject().withoutRole().build(), p("read:projects"), null);

            assertThat(decision.isGranted()).isFalse();
            assertThat(decision.reason()).isEqualTo(Reason.INVALID_REQUEST);
        }

        @Test
        @DisplayName("should still honour overrides for a subject without a role")
        void shouldHonourOverrideWithoutRole() {
            Subject subject = aSubject().withoutRole().withPermissions("read:reports").build();

            assertThat(resolver.hasPermission(subject, p("read:reports"), null)).isTrue();
        }

        @Test
        @DisplayName("should deny a missing subject or permission")
        void shouldDenyMissingInput() {
            assertThat(resolver.hasPermission(null, p("read:projects"), null)).isFalse();
            assertThat(resolver.hasPermission(aGuest(), null, null)).isFalse();
        }

        @Test
        @DisplayName("should deny when the predicate throws")
        void shouldDenyOnPredicateFailure() {
            PermissionPredicate exploding = new PermissionPredicate() {
                @Override
                public Permission getPermission() {
                    return p("read:tasks");
                }

                @Override
                public String getDescription() {
                    return "explodes";
                }

                @Override
                public boolean test(Subject subject, String resourceId) {
                    throw new IllegalStateException("directory unavailable");
                }
            };
            PermissionResolver failing = new PermissionResolver(AccessControlFixtures.HIERARCHY,
                    AccessControlFixtures.catalog(), PredicateRegistry.of(List.of(exploding)));

            AccessDecision decision = failing.resolve(aClient(), p("read:tasks"), "t-1");

            assertThat(decision.isGranted()).isFalse();
            assertThat(decision.reason()).isEqualTo(Reason.PREDICATE_ERROR);
            assertThat(decision.detail()).contains("directory unavailable");
        }

        @Test
        @DisplayName("should never let a predicate grant what the catalog withholds")
        void predicateCannotWiden() {
            PermissionPredicate permissive = new PermissionPredicate() {
                @Override
                public Permission getPermission() {
                    return p("delete:projects");
                }

                @Override
                public String getDescription() {
                    return "always passes";
                }

                @Override
                public boolean test(Subject subject, String resourceId) {
                    return true;
                }
            };
            PermissionResolver widened = new PermissionResolver(AccessControlFixtures.HIERARCHY,
                    AccessControlFixtures.catalog(), PredicateRegistry.of(List.of(permissive)));

            assertThat(widened.hasPermission(aClient(), p("delete:projects"), "p-1")).isFalse();
            assertThat(widened.hasPermission(anAdmin(), p("delete:projects"), "p-1")).isTrue();
        }
    }

    @Test
    @DisplayName("should give the same answer on repeated calls")
    void shouldBeIdempotent() {
        Subject developer = aDeveloper();

        boolean first = resolver.hasPermission(developer, p("read:clients"), "acme");
        boolean second = resolver.hasPermission(developer, p("read:clients"), "acme");

        assertThat(first).isTrue().isEqualTo(second);
    }
}
