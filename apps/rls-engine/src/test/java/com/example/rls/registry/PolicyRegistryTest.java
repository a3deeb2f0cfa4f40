package com.example.rls.registry;

import com.example.rls.context.Operation;
import com.example.rls.exception.ConfigurationException;
import com.example.rls.policy.DecisionType;
import com.example.rls.policy.PolicyCondition;
import com.example.rls.policy.PolicyDefinition;
import com.example.rls.policy.PolicyOptions;
import com.example.rls.policy.RlsSchema;
import com.example.rls.policy.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.rls.policy.Policies.allow;
import static com.example.rls.policy.Policies.deny;
import static com.example.rls.policy.Policies.filter;
import static com.example.rls.policy.Policies.validate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PolicyRegistry")
class PolicyRegistryTest {

    private PolicyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PolicyRegistry();
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should reject a table registered twice")
        void shouldRejectDuplicateTable() {
            registry.register("posts", TableSchema.of());

            assertThatThrownBy(() -> registry.register("posts", TableSchema.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("posts");
        }

        @Test
        @DisplayName("should reject duplicate policy names within a table")
        void shouldRejectDuplicatePolicyNames() {
            TableSchema schema = TableSchema.of(
                    allow(Operation.READ, PolicyCondition.always(), PolicyOptions.named("same")),
                    deny(Operation.DELETE, PolicyOptions.named("same")));

            assertThatThrownBy(() -> registry.register("posts", schema))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("same");
        }

        @Test
        @DisplayName("should reject a table declared twice in one schema builder")
        void shouldRejectDuplicateTableInBuilder() {
            RlsSchema.Builder builder = RlsSchema.builder().table("posts", TableSchema.of());

            assertThatThrownBy(() -> builder.table("posts", TableSchema.of()))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should keep tables in registration order")
        void shouldKeepRegistrationOrder() {
            registry.loadSchema(RlsSchema.builder()
                    .table("users", TableSchema.of())
                    .table("posts", TableSchema.of())
                    .table("comments", TableSchema.of())
                    .build());

            assertThat(registry.getTables()).containsExactly("users", "posts", "comments");
            assertThat(registry.hasTable("posts")).isTrue();
            assertThat(registry.hasTable("orders")).isFalse();
        }
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("should order by descending priority and keep declaration order on ties")
        void shouldSortStably() {
            registry.register("posts", TableSchema.of(
                    allow(Operation.READ, PolicyCondition.always(), PolicyOptions.named("low", 10)),
                    allow(Operation.READ, PolicyCondition.always(), PolicyOptions.named("tie-first", 50)),
                    deny(Operation.READ, PolicyOptions.named("high", 200)),
                    allow(Operation.READ, PolicyCondition.always(), PolicyOptions.named("tie-second", 50))));

            assertThat(registry.getPoliciesFor("posts", Operation.READ))
                    .extracting(PolicyDefinition::name)
                    .containsExactly("high", "tie-first", "tie-second", "low");
        }

        @Test
        @DisplayName("should include ALL policies and filter by decision type")
        void shouldFilterByOperationAndType() {
            registry.register("posts", TableSchema.of(
                    allow(Operation.ALL, PolicyCondition.always(), PolicyOptions.named("everything")),
                    deny(Operation.DELETE, PolicyOptions.named("no-delete")),
                    filter(Operation.READ, ctx -> Map.of("tenant_id", "t"), PolicyOptions.named("tenant"))));

            assertThat(registry.getPoliciesFor("posts", Operation.DELETE))
                    .extracting(PolicyDefinition::name)
                    .containsExactly("everything", "no-delete");
            assertThat(registry.getPoliciesFor("posts", Operation.READ, DecisionType.FILTER))
                    .extracting(PolicyDefinition::name)
                    .containsExactly("tenant");
            assertThat(registry.getPoliciesFor("unknown", Operation.READ)).isEmpty();
        }

        @Test
        @DisplayName("should read back the registered schema")
        void shouldRoundTripSchema() {
            TableSchema schema = TableSchema.builder()
                    .policy(allow(Operation.READ, PolicyCondition.always(), PolicyOptions.named("read")))
                    .policy(validate(Operation.CREATE, ctx -> true, PolicyOptions.named("check")))
                    .defaultDeny(true)
                    .skipForRole("admin")
                    .build();
            registry.register("posts", schema);

            CompiledTable compiled = registry.getTable("posts").orElseThrow();
            assertThat(compiled.defaultDeny()).isTrue();
            assertThat(compiled.skipFor()).containsExactly("admin");
            assertThat(compiled.policies()).extracting(PolicyDefinition::name)
                    .containsExactlyInAnyOrder("read", "check");
            assertThat(registry.isDefaultDeny("posts")).isTrue();
            assertThat(registry.getSkipFor("posts")).containsExactly("admin");
            assertThat(registry.findPolicy("posts", "check")).isPresent();
            assertThat(registry.findPolicy("posts", "missing")).isEmpty();
        }

        @Test
        @DisplayName("should group policy names by type")
        void shouldListPolicies() {
            registry.register("posts", TableSchema.of(
                    allow(Operation.READ, PolicyCondition.always(), PolicyOptions.named("a")),
                    deny(Operation.DELETE, PolicyOptions.named("d")),
                    filter(Operation.READ, ctx -> Map.of(), PolicyOptions.named("f")),
                    validate(Operation.UPDATE, ctx -> true, PolicyOptions.named("v"))));

            PolicyListing listing = registry.listPolicies("posts");

            assertThat(listing.allows()).containsExactly("a");
            assertThat(listing.denies()).containsExactly("d");
            assertThat(listing.filters()).containsExactly("f");
            assertThat(listing.validates()).containsExactly("v");
        }
    }
}
