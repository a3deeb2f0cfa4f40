package com.example.rls.engine;

import com.example.rls.policy.DecisionType;
import org.springframework.lang.Nullable;

/**
 * One entry of an evaluation trace.
 *
 * @param error message of the predicate failure, when the predicate threw
 */
public record PolicyTrace(
        String name,
        DecisionType decisionType,
        boolean active,
        boolean matched,
        @Nullable String error
) {
    public static PolicyTrace inactive(String name, DecisionType type) {
        return new PolicyTrace(name, type, false, false, null);
    }

    public static PolicyTrace evaluated(String name, DecisionType type, boolean matched) {
        return new PolicyTrace(name, type, true, matched, null);
    }

    public static PolicyTrace failed(String name, DecisionType type, String error) {
        return new PolicyTrace(name, type, true, false, error);
    }

    public boolean failed() {
        return error != null;
    }
}
