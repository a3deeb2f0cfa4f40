package com.example.rls.policy;

import com.example.rls.context.Operation;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Allow, deny or validate policy.
 */
public record ConditionPolicy(
        String name,
        DecisionType decisionType,
        Set<Operation> operations,
        int priority,
        ReactivePolicyCondition condition,
        @Nullable ActivationCondition activationCondition,
        PolicyHints hints
) implements PolicyDefinition {

    public ConditionPolicy {
        if (decisionType == DecisionType.FILTER) {
            throw new IllegalArgumentException("Filter policies must be declared as FilterPolicy");
        }
        operations = Set.copyOf(operations);
        hints = hints != null ? hints : PolicyHints.none();
    }

    @Override
    public ConditionPolicy withActivationCondition(ActivationCondition condition) {
        return new ConditionPolicy(name, decisionType, operations, priority, this.condition, condition, hints);
    }
}
