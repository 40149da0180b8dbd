package com.example.rbac.authz.model;

import com.example.rbac.authz.exception.InvalidPermissionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Permission")
class PermissionTest {

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("should parse action:resource into enum pair")
        void shouldParseCanonicalForm() {
            Permission permission = Permission.parse("configure:ai_insights");

            assertThat(permission.action()).isEqualTo(Action.CONFIGURE);
            assertThat(permission.resource()).isEqualTo(Resource.AI_INSIGHTS);
        }

        @Test
        @DisplayName("should tolerate surrounding whitespace and upper case")
        void shouldNormalizeInput() {
            assertThat(Permission.tryParse("  UPDATE:Projects ")).contains(Permission.of(Action.UPDATE, Resource.PROJECTS));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"read", "read:", ":projects", "read:projects:extra", "fly:projects", "read:spaceships",
                "read projects"})
        @DisplayName("should reject malformed values without throwing on the lenient path")
        void shouldRejectMalformed(String value) {
            assertThat(Permission.tryParse(value)).isEmpty();
        }

        @Test
        @DisplayName("should throw InvalidPermissionException on the strict path")
        void shouldThrowOnStrictParse() {
            assertThatThrownBy(() -> Permission.parse("fly:projects"))
                    .isInstanceOf(InvalidPermissionException.class)
                    .hasMessageContaining("fly:projects");
        }
    }

    @Test
    @DisplayName("should serialize as lower-case action:resource")
    void shouldSerializeCanonically() {
        Permission permission = Permission.of(Action.READ, Resource.AI_INSIGHTS);

        assertThat(permission.value()).isEqualTo("read:ai_insights");
        assertThat(permission).hasToString("read:ai_insights");
    }

    @Test
    @DisplayName("should compare equal when built from the same pair")
    void shouldHaveValueSemantics() {
        assertThat(Permission.parse("update:tasks")).isEqualTo(Permission.of(Action.UPDATE, Resource.TASKS));
    }
}
