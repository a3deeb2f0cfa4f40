package com.example.rls.fieldaccess;

import com.example.rls.policy.PolicyCondition;
import org.springframework.lang.Nullable;

import java.util.function.UnaryOperator;

/**
 * A field rule with absent predicates resolved to {@link PolicyCondition#always()}.
 */
public record CompiledFieldAccess(
        String field,
        PolicyCondition canRead,
        PolicyCondition canWrite,
        @Nullable UnaryOperator<Object> maskFn,
        @Nullable Object maskedValue,
        boolean omitWhenHidden
) {
    static CompiledFieldAccess compile(String field, FieldAccessConfig config) {
        return new CompiledFieldAccess(
                field,
                config.read() != null ? config.read() : PolicyCondition.always(),
                config.write() != null ? config.write() : PolicyCondition.always(),
                config.maskFn(),
                config.maskedValue(),
                config.omitWhenHidden());
    }
}
