package io.github.simbo1905.json.openapi.codegen;

import io.github.simbo1905.json.openapi.codegen.CodegenOptions.NamingStyle;
import io.github.simbo1905.json.openapi.codegen.NameRegistry.Differentiated;
import io.github.simbo1905.json.openapi.codegen.NameRegistry.IdentifierRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NameRegistryTest extends CodegenTestBase {

    private final NameRegistry registry = new NameRegistry(CodegenOptions.defaults());

    @Test
    void typeNamesArePascalCase() {
        assertThat(registry.toTypeName("user_status")).isEqualTo("UserStatus");
        assertThat(registry.toTypeName("USER_STATUS")).isEqualTo("UserStatus");
        assertThat(registry.toTypeName("user-status.v2")).isEqualTo("UserStatusV2");
        assertThat(registry.toTypeName("order item")).isEqualTo("OrderItem");
        assertThat(registry.toTypeName("myAPIResponse")).isEqualTo("MyAPIResponse");
        assertThat(registry.toTypeName("#/components/schemas/Pet")).isEqualTo("Pet");
    }

    @Test
    void leadingDigitGetsUnderscorePrefix() {
        assertThat(registry.toTypeName("123invalid")).isEqualTo("_123invalid");
        assertThat(registry.toEnumMemberName("200")).isEqualTo("_200");
    }

    @Test
    void signsBecomeWords() {
        assertThat(registry.toEnumMemberName("+1")).isEqualTo("Plus1");
        assertThat(registry.toEnumMemberName("-1")).isEqualTo("Minus1");
        assertThat(registry.toEnumMemberName("in-progress")).isEqualTo("InProgress");
    }

    @Test
    void blankInputFallsBackPerRole() {
        assertThat(registry.toTypeName("")).isEqualTo("UnknownType");
        assertThat(registry.toTypeName("   ")).isEqualTo("UnknownType");
        assertThat(registry.toMemberName(null)).isEqualTo("Unknown");
        assertThat(registry.toEnumMemberName("$")).isEqualTo("Unknown");
    }

    @Test
    void camelCaseFallbackIsAlreadyCanonical() {
        final var camel = new NameRegistry(CodegenOptions.defaults().withMemberNaming(NamingStyle.CAMEL_CASE));
        assertThat(camel.toMemberName("")).isEqualTo("unknown");
        assertThat(camel.toMemberName("$")).isEqualTo("unknown");
        assertThat(camel.toMemberName(camel.toMemberName(" "))).isEqualTo(camel.toMemberName(" "));
    }

    @Test
    void reservedWordsAreEscapedInCamelCase() {
        final var camel = new NameRegistry(CodegenOptions.defaults().withMemberNaming(NamingStyle.CAMEL_CASE));
        assertThat(camel.toMemberName("class")).isEqualTo("class_");
        assertThat(camel.toMemberName("user_name")).isEqualTo("userName");
        assertThat(camel.toMemberName("URL")).isEqualTo("url");
        // PascalCase never produces a lowercase keyword
        assertThat(registry.toMemberName("class")).isEqualTo("Class");
    }

    @Test
    void customReservedWordsAreEscaped() {
        final var custom = new NameRegistry(CodegenOptions.defaults().withReservedWords(Set.of("Object")));
        assertThat(custom.toTypeName("object")).isEqualTo("Object_");
        assertThat(custom.toTypeName("Object_")).isEqualTo("Object_");
    }

    @Test
    void canonicalNamesMapToThemselves() {
        for (var raw : List.of("A_B", "x_y_z", "aB_C", "_", "123invalid", "myAPIResponse", "in-progress")) {
            final String once = registry.toTypeName(raw);
            assertThat(registry.toTypeName(once)).as("canonicalize(canonicalize(%s))", raw).isEqualTo(once);
        }
        assertThat(registry.toTypeName("A_B")).isEqualTo("Ab");
    }

    @Test
    void naturalnessScores() {
        assertThat(NameRegistry.naturalnessScore("Name", "Name")).isZero();
        assertThat(NameRegistry.naturalnessScore("name", "Name")).isEqualTo(1);
        assertThat(NameRegistry.naturalnessScore("myType", "MyType")).isEqualTo(1);
        assertThat(NameRegistry.naturalnessScore("_id", "Id")).isEqualTo(11);
        assertThat(NameRegistry.naturalnessScore("my-field.x", "MyFieldX")).isEqualTo(12);
        assertThat(NameRegistry.naturalnessScore("123abc", "_123abc")).isEqualTo(2);
    }

    @Test
    void underscorePrefixedIdIsDifferentiated() {
        final var resolution = registry.resolveCollision(List.of("_id", "id"), IdentifierRole.MEMBER, Set.of());

        assertThat(resolution.canonicalName()).isEqualTo("Id");
        assertThat(resolution.winner()).isEqualTo("id");
        assertThat(resolution.others()).containsExactly(new Differentiated("_id", "UnderscoreId"));
        assertThat(resolution.assigned()).containsExactly("UnderscoreId", "Id");
    }

    @Test
    void exactMatchWinsThreeWayCollision() {
        final var resolution = registry.resolveCollision(List.of("_name", "name", "Name"), IdentifierRole.MEMBER, Set.of());

        assertThat(resolution.winner()).isEqualTo("Name");
        assertThat(resolution.assigned()).containsExactly("UnderscoreName", "NameLowercase", "Name");
    }

    @Test
    void innerUnderscoreExpandsEveryCharacter() {
        final var resolution = registry.resolveCollision(List.of("my_string", "myString"), IdentifierRole.TYPE, Set.of());

        assertThat(resolution.winner()).isEqualTo("myString");
        assertThat(resolution.assigned()).containsExactly("MyUnderscoreString", "MyString");
    }

    @Test
    void namingStyleSuffixWhenExpansionDoesNotHelp() {
        final var resolution = registry.resolveCollision(List.of("myType", "MyType"), IdentifierRole.TYPE, Set.of());

        assertThat(resolution.assigned()).containsExactly("MyTypeCamelCase", "MyType");
        assertThat(NameRegistry.namingStyleSuffix("my-type")).isEqualTo("KebabCase");
        assertThat(NameRegistry.namingStyleSuffix("my.type")).isEqualTo("DotNotation");
        assertThat(NameRegistry.namingStyleSuffix("ORDER")).isEqualTo("Uppercase");
    }

    @Test
    void numericSuffixIsTheLastResort() {
        final var resolution = registry.resolveCollision(List.of("Name", "name"), IdentifierRole.TYPE,
                Set.of("NameLowercase"));

        assertThat(resolution.assigned()).containsExactly("Name", "Name2");
    }

    @Test
    void assignRecordsAllocationsInOrder() {
        final var names = registry.assign(NameRegistry.TYPE_SCOPE, List.of("Order", "order", "ORDER"), IdentifierRole.TYPE);

        assertThat(names).containsExactly("Order", "OrderLowercase", "OrderUppercase");
        assertThat(registry.allocations(NameRegistry.TYPE_SCOPE)).containsOnlyKeys("Order", "OrderLowercase", "OrderUppercase");
        assertThat(registry.allocations(NameRegistry.TYPE_SCOPE).get("OrderUppercase")).containsExactly("ORDER");
    }

    @Test
    void reservedNameForcesDifferentiation() {
        registry.reserve(NameRegistry.TYPE_SCOPE, "Status", "Status");

        final var names = registry.assign(NameRegistry.TYPE_SCOPE, List.of("status"), IdentifierRole.TYPE);

        assertThat(names).containsExactly("StatusLowercase");
        assertThat(registry.isAllocated(NameRegistry.TYPE_SCOPE, "Status")).isTrue();
    }

    @Test
    void repeatedRawNamesGetDistinctIdentifiers() {
        final var names = registry.assign(NameRegistry.TYPE_SCOPE, List.of("status", "status", "status"), IdentifierRole.TYPE);

        assertThat(names).containsExactly("Status", "StatusLowercase", "Status2");
    }

    @Test
    void scopesAreIndependent() {
        registry.assign("members:A", List.of("id"), IdentifierRole.MEMBER);
        final var names = registry.assign("members:B", List.of("id"), IdentifierRole.MEMBER);

        assertThat(names).containsExactly("Id");
        assertThat(registry.allocations("members:C")).isEmpty();
    }
}
