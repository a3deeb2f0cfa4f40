package com.example.rls.policy;

import com.example.rls.context.Operation;
import com.example.rls.exception.ConfigurationException;
import com.example.rls.exception.RlsErrorCode;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Factories for policy definitions and their conditional-activation wrappers.
 *
 * <pre>{@code
 * TableSchema posts = TableSchema.builder()
 *         .policy(filter(READ, ctx -> Map.of("tenant_id", ctx.auth().tenantId()),
 *                 PolicyOptions.named("tenant-isolation", 100)))
 *         .policy(deny(DELETE, always(), PolicyOptions.named("no-delete", 200)))
 *         .policy(whenFeature("strict_rls",
 *                 () -> deny(UPDATE, ctx -> Boolean.TRUE.equals(ctx.rowValue("locked")),
 *                         PolicyOptions.named("locked-rows"))))
 *         .build();
 * }</pre>
 */
public final class Policies {

    private Policies() {
        // Utility class
    }

    // ----------------------------------------------------------------------
    // Allow
    // ----------------------------------------------------------------------

    public static PolicyDefinition allow(Operation operation, PolicyCondition condition, PolicyOptions options) {
        return allow(EnumSet.of(operation), condition, options);
    }

    public static PolicyDefinition allow(Set<Operation> operations, PolicyCondition condition, PolicyOptions options) {
        return allowAsync(operations, ReactivePolicyCondition.of(condition), options);
    }

    public static PolicyDefinition allowAsync(
            Operation operation, ReactivePolicyCondition condition, PolicyOptions options) {
        return allowAsync(EnumSet.of(operation), condition, options);
    }

    public static PolicyDefinition allowAsync(
            Set<Operation> operations, ReactivePolicyCondition condition, PolicyOptions options) {
        return conditionPolicy(DecisionType.ALLOW, operations, condition, options);
    }

    // ----------------------------------------------------------------------
    // Deny
    // ----------------------------------------------------------------------

    /**
     * Unconditional deny.
     */
    public static PolicyDefinition deny(Operation operation, PolicyOptions options) {
        return deny(operation, PolicyCondition.always(), options);
    }

    public static PolicyDefinition deny(Operation operation, PolicyCondition condition, PolicyOptions options) {
        return deny(EnumSet.of(operation), condition, options);
    }

    public static PolicyDefinition deny(Set<Operation> operations, PolicyCondition condition, PolicyOptions options) {
        return denyAsync(operations, ReactivePolicyCondition.of(condition), options);
    }

    public static PolicyDefinition denyAsync(
            Operation operation, ReactivePolicyCondition condition, PolicyOptions options) {
        return denyAsync(EnumSet.of(operation), condition, options);
    }

    public static PolicyDefinition denyAsync(
            Set<Operation> operations, ReactivePolicyCondition condition, PolicyOptions options) {
        return conditionPolicy(DecisionType.DENY, operations, condition, options);
    }

    // ----------------------------------------------------------------------
    // Filter
    // ----------------------------------------------------------------------

    /**
     * Read filter. {@link Operation#ALL} is accepted and normalised to READ;
     * filters never apply to writes.
     */
    public static PolicyDefinition filter(Operation operation, FilterCondition filter, PolicyOptions options) {
        if (operation != Operation.READ && operation != Operation.ALL) {
            throw new ConfigurationException(
                    String.format("Filter policy '%s' must target READ or ALL, got %s",
                            options != null ? options.name() : null, operation),
                    RlsErrorCode.RLS_POLICY_INVALID);
        }
        requireName(options);
        if (filter == null) {
            throw new ConfigurationException(
                    "Filter policy '" + options.name() + "' has no filter function", RlsErrorCode.RLS_POLICY_INVALID);
        }
        return new FilterPolicy(options.name(), EnumSet.of(Operation.READ), options.priority(),
                filter, options.condition(), options.hints());
    }

    // ----------------------------------------------------------------------
    // Validate
    // ----------------------------------------------------------------------

    /**
     * Payload validation for writes. {@link Operation#ALL} expands to CREATE and UPDATE.
     */
    public static PolicyDefinition validate(Operation operation, PolicyCondition condition, PolicyOptions options) {
        return validateAsync(operation, ReactivePolicyCondition.of(condition), options);
    }

    public static PolicyDefinition validateAsync(
            Operation operation, ReactivePolicyCondition condition, PolicyOptions options) {
        Set<Operation> operations = switch (operation) {
            case CREATE -> EnumSet.of(Operation.CREATE);
            case UPDATE -> EnumSet.of(Operation.UPDATE);
            case ALL -> EnumSet.of(Operation.CREATE, Operation.UPDATE);
            default -> throw new ConfigurationException(
                    String.format("Validate policy '%s' must target CREATE, UPDATE or ALL, got %s",
                            options != null ? options.name() : null, operation),
                    RlsErrorCode.RLS_POLICY_INVALID);
        };
        return conditionPolicy(DecisionType.VALIDATE, operations, condition, options);
    }

    // ----------------------------------------------------------------------
    // Conditional activation
    // ----------------------------------------------------------------------

    /**
     * Active only when the activation environment is one of {@code environments}.
     */
    public static PolicyDefinition whenEnvironment(Collection<String> environments, Supplier<PolicyDefinition> factory) {
        return whenEnvironment(environments, factory.get());
    }

    public static PolicyDefinition whenEnvironment(Collection<String> environments, PolicyDefinition policy) {
        List<String> allowed = List.copyOf(environments);
        return compose(policy, ctx -> allowed.contains(ctx.environment()));
    }

    /**
     * Active only when feature flag {@code feature} is truthy.
     */
    public static PolicyDefinition whenFeature(String feature, Supplier<PolicyDefinition> factory) {
        return whenFeature(feature, factory.get());
    }

    public static PolicyDefinition whenFeature(String feature, PolicyDefinition policy) {
        return compose(policy, ctx -> ctx.isFeatureEnabled(feature));
    }

    /**
     * Active while the hour of the activation timestamp lies in
     * {@code [startHour, endHour)}. When {@code startHour > endHour} the range
     * crosses midnight, so 22→6 covers 22:00-05:59.
     */
    public static PolicyDefinition whenTimeRange(int startHour, int endHour, Supplier<PolicyDefinition> factory) {
        return whenTimeRange(startHour, endHour, factory.get());
    }

    public static PolicyDefinition whenTimeRange(int startHour, int endHour, PolicyDefinition policy) {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 24) {
            throw new ConfigurationException(
                    String.format("Invalid hour range %d-%d for policy '%s'", startHour, endHour, policy.name()),
                    RlsErrorCode.RLS_POLICY_INVALID);
        }
        return compose(policy, ctx -> isHourInRange(ctx.hour(), startHour, endHour));
    }

    /**
     * Active when an arbitrary predicate over the activation context holds.
     */
    public static PolicyDefinition whenCondition(ActivationCondition condition, Supplier<PolicyDefinition> factory) {
        return whenCondition(condition, factory.get());
    }

    public static PolicyDefinition whenCondition(ActivationCondition condition, PolicyDefinition policy) {
        return compose(policy, condition);
    }

    static boolean isHourInRange(int hour, int startHour, int endHour) {
        if (startHour > endHour) {
            return hour >= startHour || hour < endHour;
        }
        return hour >= startHour && hour < endHour;
    }

    // Outer condition first, then whatever an inner wrapper already attached.
    private static PolicyDefinition compose(PolicyDefinition policy, ActivationCondition outer) {
        ActivationCondition existing = policy.activationCondition();
        return policy.withActivationCondition(existing == null ? outer : outer.and(existing));
    }

    private static ConditionPolicy conditionPolicy(
            DecisionType type,
            Set<Operation> operations,
            ReactivePolicyCondition condition,
            PolicyOptions options) {
        requireName(options);
        if (operations == null || operations.isEmpty()) {
            throw new ConfigurationException(
                    "Policy '" + options.name() + "' must target at least one operation", RlsErrorCode.RLS_POLICY_INVALID);
        }
        if (condition == null) {
            throw new ConfigurationException(
                    "Policy '" + options.name() + "' has no condition", RlsErrorCode.RLS_POLICY_INVALID);
        }
        return new ConditionPolicy(options.name(), type, operations, options.priority(),
                condition, options.condition(), options.hints());
    }

    private static void requireName(PolicyOptions options) {
        if (options == null || options.name() == null || options.name().isBlank()) {
            throw new ConfigurationException("Every policy requires a non-blank name", RlsErrorCode.RLS_POLICY_INVALID);
        }
    }
}
