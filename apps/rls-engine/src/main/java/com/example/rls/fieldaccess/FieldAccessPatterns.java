package com.example.rls.fieldaccess;

import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.policy.PolicyCondition;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Ready-made field rules for the common cases.
 */
public final class FieldAccessPatterns {

    private FieldAccessPatterns() {
        // Utility class
    }

    /**
     * Hidden from everyone except bypass callers; the key is dropped from masked rows.
     */
    public static FieldAccessConfig neverAccessible() {
        return FieldAccessConfig.builder()
                .read(PolicyCondition.never())
                .write(PolicyCondition.never())
                .omitWhenHidden(true)
                .build();
    }

    /**
     * Readable and writable only when the row's {@code ownerField} equals the caller's user id.
     */
    public static FieldAccessConfig ownerOnly(String ownerField) {
        PolicyCondition owner = ctx -> isOwner(ctx, ownerField);
        return FieldAccessConfig.builder()
                .read(owner)
                .write(owner)
                .build();
    }

    public static FieldAccessConfig ownerOrRoles(Collection<String> roles, String ownerField) {
        Set<String> allowed = Set.copyOf(roles);
        PolicyCondition condition = ctx -> isOwner(ctx, ownerField) || ctx.auth().hasAnyRole(allowed);
        return FieldAccessConfig.builder()
                .read(condition)
                .write(condition)
                .build();
    }

    public static FieldAccessConfig rolesOnly(Collection<String> roles) {
        Set<String> allowed = Set.copyOf(roles);
        PolicyCondition condition = ctx -> ctx.auth().hasAnyRole(allowed);
        return FieldAccessConfig.builder()
                .read(condition)
                .write(condition)
                .build();
    }

    public static FieldAccessConfig readOnly() {
        return readOnly(PolicyCondition.always());
    }

    public static FieldAccessConfig readOnly(PolicyCondition readCondition) {
        return FieldAccessConfig.builder()
                .read(readCondition)
                .write(PolicyCondition.never())
                .build();
    }

    public static FieldAccessConfig publicReadRestrictedWrite(PolicyCondition writeCondition) {
        return FieldAccessConfig.builder()
                .read(PolicyCondition.always())
                .write(writeCondition)
                .build();
    }

    /**
     * Shows the real value when {@code readCondition} holds and {@code maskFn(value)} otherwise.
     */
    public static FieldAccessConfig maskedField(UnaryOperator<Object> maskFn, PolicyCondition readCondition) {
        return FieldAccessConfig.builder()
                .read(readCondition)
                .write(readCondition)
                .maskFn(maskFn)
                .build();
    }

    // Compared as strings so numeric ids match their textual form.
    private static boolean isOwner(PolicyEvaluationContext ctx, String ownerField) {
        Object owner = ctx.rowValue(ownerField);
        return owner != null && Objects.equals(String.valueOf(owner), String.valueOf(ctx.auth().userId()));
    }
}
