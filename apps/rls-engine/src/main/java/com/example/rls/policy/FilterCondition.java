package com.example.rls.policy;

import com.example.rls.context.PolicyEvaluationContext;

import java.util.Map;

/**
 * Produces column/value pairs that are ANDed into a read query.
 * A {@code null} value means IS NULL; a collection value means IN.
 */
@FunctionalInterface
public interface FilterCondition {

    Map<String, Object> apply(PolicyEvaluationContext ctx);
}
