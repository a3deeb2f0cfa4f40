package com.example.rls.transformer;

import com.example.rls.context.Operation;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.context.RlsContextHolder;
import com.example.rls.engine.ActivationContextProvider;
import com.example.rls.engine.PolicyEvaluator;
import com.example.rls.exception.AccessDeniedException;
import com.example.rls.exception.PolicyEvaluationException;
import com.example.rls.exception.RlsContextException;
import com.example.rls.context.PolicyActivationContext;
import com.example.rls.policy.PolicyOptions;
import com.example.rls.policy.TableSchema;
import com.example.rls.registry.PolicyRegistry;
import com.example.rls.util.RecordingQuery;
import com.example.rls.util.RecordingQuery.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.rls.policy.Policies.deny;
import static com.example.rls.policy.Policies.filter;
import static com.example.rls.policy.Policies.whenFeature;
import static com.example.rls.util.AuthContextTestBuilder.aSystemUser;
import static com.example.rls.util.AuthContextTestBuilder.anAuthContext;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SelectTransformer")
class SelectTransformerTest {

    private PolicyRegistry registry;
    private SelectTransformer transformer;

    private final PolicyEvaluationContext user = anAuthContext().buildEvaluationContext();

    @BeforeEach
    void setUp() {
        registry = new PolicyRegistry();
        PolicyEvaluator evaluator = new PolicyEvaluator(registry, ActivationContextProvider.fixed(
                PolicyActivationContext.of("test", Map.of(), Instant.now())));
        transformer = new SelectTransformer(evaluator);
    }

    @Nested
    @DisplayName("Filter conditions")
    class FilterConditions {

        @Test
        @DisplayName("should add a table-qualified equality predicate")
        void shouldAddEquality() {
            registry.register("users", TableSchema.of(
                    filter(Operation.READ, ctx -> Map.of("tenant_id", ctx.auth().tenantId()),
                            PolicyOptions.named("tenant"))));

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "users", user))
                    .assertNext(query -> assertThat(query.predicates())
                            .containsExactly(new Predicate("users.tenant_id", "=", "tenant-1")))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should translate null, lists and arrays")
        void shouldTranslateValueShapes() {
            registry.register("posts", TableSchema.of(
                    filter(Operation.READ, ctx -> {
                        Map<String, Object> conditions = new HashMap<>();
                        conditions.put("deleted_at", null);
                        conditions.put("status", List.of("draft", "published"));
                        conditions.put("org_id", new String[]{"o1", "o2"});
                        return conditions;
                    }, PolicyOptions.named("shape"))));

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "posts", user))
                    .assertNext(query -> assertThat(query.predicates()).containsExactlyInAnyOrder(
                            new Predicate("posts.deleted_at", "is", null),
                            new Predicate("posts.status", "in", List.of("draft", "published")),
                            new Predicate("posts.org_id", "in", Arrays.asList("o1", "o2"))))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should match nothing for an empty list")
        void shouldMatchNothingForEmptyList() {
            registry.register("posts", TableSchema.of(
                    filter(Operation.READ, ctx -> Map.of("org_id", List.of()), PolicyOptions.named("orgs"))));

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "posts", user))
                    .assertNext(query -> assertThat(query.predicates()).containsExactly(RecordingQuery.FALSE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should leave the query untouched for system users")
        void shouldNotFilterForSystemUser() {
            registry.register("users", TableSchema.of(
                    filter(Operation.READ, ctx -> Map.of("tenant_id", "t"), PolicyOptions.named("tenant"))));

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "users",
                            PolicyEvaluationContext.of(aSystemUser())))
                    .assertNext(query -> assertThat(query.predicates()).isEmpty())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should reject a denied read instead of returning an empty query")
        void shouldRejectDeniedRead() {
            registry.register("secrets", TableSchema.of(deny(Operation.READ, PolicyOptions.named("no-read"))));

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "secrets", user))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AccessDeniedException.class);
                        AccessDeniedException denied = (AccessDeniedException) error;
                        assertThat(denied.getPolicyName()).isEqualTo("no-read");
                        assertThat(denied.getDecision()).isNotNull();
                    })
                    .verify();
        }

        @Test
        @DisplayName("should propagate a throwing filter")
        void shouldPropagateFilterFailure() {
            registry.register("users", TableSchema.of(
                    filter(Operation.READ, ctx -> {
                        throw new IllegalStateException("boom");
                    }, PolicyOptions.named("tenant"))));

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "users", user))
                    .expectError(PolicyEvaluationException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Ambient context")
    class AmbientContext {

        @Test
        @DisplayName("should read the caller from the subscriber context")
        void shouldUseAmbientContext() {
            registry.register("users", TableSchema.of(
                    filter(Operation.READ, ctx -> Map.of("tenant_id", ctx.auth().tenantId()),
                            PolicyOptions.named("tenant"))));

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "users")
                            .contextWrite(RlsContextHolder.withAuth(anAuthContext().withTenantId("acme").build())))
                    .assertNext(query -> assertThat(query.predicates())
                            .containsExactly(new Predicate("users.tenant_id", "=", "acme")))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail when there is no ambient context")
        void shouldFailWithoutContext() {
            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "users"))
                    .expectError(RlsContextException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Activation context")
    class Activation {

        @Test
        @DisplayName("should read the activation context once for decision and filters")
        void shouldReadActivationOnce() {
            AtomicInteger reads = new AtomicInteger();
            PolicyEvaluator flipping = new PolicyEvaluator(registry, () -> PolicyActivationContext.of(
                    "test", Map.of("strict", reads.incrementAndGet() > 1), Instant.now()));
            registry.register("posts", TableSchema.of(
                    whenFeature("strict", () -> filter(Operation.READ,
                            ctx -> Map.of("tenant_id", ctx.auth().tenantId()), PolicyOptions.named("strict-tenant")))));

            StepVerifier.create(new SelectTransformer(flipping).transform(RecordingQuery.selectFrom(), "posts", user))
                    .assertNext(query -> assertThat(query.predicates()).isEmpty())
                    .verifyComplete();
            assertThat(reads).hasValue(1);
        }

        @Test
        @DisplayName("should apply both decision and filters against an explicit activation context")
        void shouldUseExplicitActivation() {
            registry.register("posts", TableSchema.of(
                    whenFeature("strict", () -> filter(Operation.READ,
                            ctx -> Map.of("tenant_id", ctx.auth().tenantId()), PolicyOptions.named("strict-tenant")))));
            PolicyActivationContext strict =
                    PolicyActivationContext.of("test", Map.of("strict", true), Instant.now());

            StepVerifier.create(transformer.transform(RecordingQuery.selectFrom(), "posts", user, strict))
                    .assertNext(query -> assertThat(query.predicates())
                            .containsExactly(new Predicate("posts.tenant_id", "=", "tenant-1")))
                    .verifyComplete();
        }
    }
}
