package com.example.rls.policy;

import com.example.rls.context.PolicyActivationContext;

/**
 * Decides whether a policy takes part in evaluation at all.
 */
@FunctionalInterface
public interface ActivationCondition {

    boolean isActive(PolicyActivationContext ctx);

    default ActivationCondition and(ActivationCondition other) {
        return ctx -> isActive(ctx) && other.isActive(ctx);
    }
}
