package com.example.rls.engine;

import com.example.rls.policy.DecisionType;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outcome of {@link PolicyEvaluator#evaluate}.
 */
public record EvaluationResult(
        boolean allowed,
        DecisionType decisionType,
        @Nullable String reason,
        @Nullable String policyName,
        List<PolicyTrace> evaluatedPolicies
) {
    public static final String REASON_SYSTEM_BYPASS = "System user bypass";
    public static final String REASON_SKIP_FOR_ROLE = "skipFor role";
    public static final String REASON_BYPASS_ROLE = "bypass role";
    public static final String REASON_EXCLUDED_TABLE = "excluded table";
    public static final String REASON_DEFAULT = "default";
    public static final String REASON_NO_POLICIES = "no policies";

    public EvaluationResult {
        evaluatedPolicies = evaluatedPolicies != null ? List.copyOf(evaluatedPolicies) : List.of();
    }

    public static EvaluationResult bypass(String reason) {
        return new EvaluationResult(true, DecisionType.ALLOW, reason, null, List.of());
    }

    public static EvaluationResult matched(DecisionType type, String policyName, List<PolicyTrace> trace) {
        boolean allowed = type == DecisionType.ALLOW;
        String reason = (allowed ? "Allowed by policy: " : "Denied by policy: ") + policyName;
        return new EvaluationResult(allowed, type, reason, policyName, trace);
    }

    public static EvaluationResult fallback(boolean defaultDeny, String reason, List<PolicyTrace> trace) {
        return new EvaluationResult(!defaultDeny, defaultDeny ? DecisionType.DENY : DecisionType.ALLOW,
                reason, null, trace);
    }
}
