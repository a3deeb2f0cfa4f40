package com.example.rls.policy;

import com.example.rls.context.PolicyEvaluationContext;

/**
 * Synchronous, side-effect-free predicate used by allow, deny and validate policies.
 */
@FunctionalInterface
public interface PolicyCondition {

    boolean test(PolicyEvaluationContext ctx);

    static PolicyCondition always() {
        return ctx -> true;
    }

    static PolicyCondition never() {
        return ctx -> false;
    }
}
