package com.example.rls.policy;

import com.example.rls.context.Operation;
import com.example.rls.context.PolicyActivationContext;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * A named, prioritized rule for one table.
 *
 * <p>Tagged by {@link #decisionType()}: allow, deny and validate policies are
 * {@link ConditionPolicy} instances carrying a predicate, filter policies are
 * {@link FilterPolicy} instances carrying a condition-map function. Callers
 * dispatch on the tag.
 */
public sealed interface PolicyDefinition permits ConditionPolicy, FilterPolicy {

    String name();

    DecisionType decisionType();

    Set<Operation> operations();

    /**
     * Higher runs first. Ties keep registration order.
     */
    int priority();

    @Nullable
    ActivationCondition activationCondition();

    PolicyHints hints();

    /**
     * Copy of this policy with {@code condition} replacing the current activation condition.
     */
    PolicyDefinition withActivationCondition(ActivationCondition condition);

    default boolean appliesTo(Operation operation) {
        return operations().contains(operation) || operations().contains(Operation.ALL);
    }

    default boolean isActive(PolicyActivationContext ctx) {
        ActivationCondition condition = activationCondition();
        return condition == null || condition.isActive(ctx);
    }
}
