package com.example.rls.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.rls.util.AuthContextTestBuilder.anAuthContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Context records")
class ContextRecordsTest {

    @Test
    @DisplayName("should treat a null feature flag as disabled")
    void shouldTreatNullFeatureAsDisabled() {
        Map<String, Object> features = new HashMap<>();
        features.put("beta", null);
        features.put("strict", true);

        PolicyActivationContext activation =
                PolicyActivationContext.of("dev", features, Instant.parse("2024-01-01T00:00:00Z"));

        assertThat(activation.isFeatureEnabled("beta")).isFalse();
        assertThat(activation.isFeatureEnabled("strict")).isTrue();
        assertThat(activation.features()).containsKey("beta");
    }

    @Test
    @DisplayName("should accept null attribute values on the auth context")
    void shouldAcceptNullAttributes() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("department", null);

        AuthContext auth = new AuthContext("u1", "t1", Set.of("user"), false, List.of(), attributes);

        assertThat(auth.attributes()).containsEntry("department", null);
    }

    @Test
    @DisplayName("should carry the same metadata the evaluation context accepts")
    void shouldCarryNullMetadata() {
        PolicyEvaluationContext evaluation = PolicyEvaluationContext.of(anAuthContext().build())
                .withMetaEntry("manager_id", null);

        RlsContext rls = new RlsContext(evaluation.auth(), evaluation.meta());

        assertThat(rls.meta()).containsEntry("manager_id", null);
        assertThat(rls.toEvaluationContext().metaValue("manager_id")).isNull();
    }

    @Test
    @DisplayName("should not reflect later changes to the source map")
    void shouldCopyDefensively() {
        Map<String, Object> features = new HashMap<>();
        features.put("beta", true);
        PolicyActivationContext activation = PolicyActivationContext.of("dev", features, Instant.now());

        features.put("beta", false);

        assertThat(activation.isFeatureEnabled("beta")).isTrue();
        assertThatThrownBy(() -> activation.features().put("other", true))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
