package com.example.rls.engine;

import com.example.rls.context.PolicyActivationContext;

/**
 * Supplies the environment, feature flags and clock reading that decide
 * which conditional policies are active for the current evaluation.
 */
@FunctionalInterface
public interface ActivationContextProvider {

    PolicyActivationContext current();

    static ActivationContextProvider fixed(PolicyActivationContext context) {
        return () -> context;
    }
}
