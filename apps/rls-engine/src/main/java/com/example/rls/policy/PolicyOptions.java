package com.example.rls.policy;

import org.springframework.lang.Nullable;

/**
 * Name, priority and optional extras shared by every policy factory.
 */
public record PolicyOptions(
        String name,
        int priority,
        PolicyHints hints,
        @Nullable ActivationCondition condition
) {
    public PolicyOptions {
        hints = hints != null ? hints : PolicyHints.none();
    }

    public static PolicyOptions named(String name) {
        return new PolicyOptions(name, 0, PolicyHints.none(), null);
    }

    public static PolicyOptions named(String name, int priority) {
        return new PolicyOptions(name, priority, PolicyHints.none(), null);
    }

    public PolicyOptions withHints(PolicyHints hints) {
        return new PolicyOptions(name, priority, hints, condition);
    }

    public PolicyOptions when(ActivationCondition condition) {
        return new PolicyOptions(name, priority, hints, condition);
    }
}
