package com.example.rls.policy;

import com.example.rls.context.Operation;
import org.springframework.lang.Nullable;

import java.util.Set;

public record FilterPolicy(
        String name,
        Set<Operation> operations,
        int priority,
        FilterCondition filter,
        @Nullable ActivationCondition activationCondition,
        PolicyHints hints
) implements PolicyDefinition {

    public FilterPolicy {
        operations = Set.copyOf(operations);
        hints = hints != null ? hints : PolicyHints.none();
    }

    @Override
    public DecisionType decisionType() {
        return DecisionType.FILTER;
    }

    @Override
    public FilterPolicy withActivationCondition(ActivationCondition condition) {
        return new FilterPolicy(name, operations, priority, filter, condition, hints);
    }
}
