package com.example.rls.engine;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Result of invoking one named policy in isolation.
 *
 * @param result     predicate outcome for allow/deny/validate policies
 * @param conditions filter output for filter policies
 */
public record PolicyTestResult(
        boolean found,
        @Nullable Boolean result,
        @Nullable Map<String, Object> conditions
) {
    public static PolicyTestResult notFound() {
        return new PolicyTestResult(false, null, null);
    }

    public static PolicyTestResult ofPredicate(boolean result) {
        return new PolicyTestResult(true, result, null);
    }

    public static PolicyTestResult ofFilter(Map<String, Object> conditions) {
        return new PolicyTestResult(true, null, conditions);
    }
}
