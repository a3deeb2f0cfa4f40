package com.example.rls.fieldaccess;

import com.example.rls.policy.PolicyCondition;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.function.UnaryOperator;

/**
 * Column-level rule.
 *
 * @param read           who may see the value; {@code null} means everyone
 * @param write          who may change the value; {@code null} means everyone
 * @param maskFn         replacement for a hidden value, computed from the real value
 * @param maskedValue    constant replacement used when there is no {@code maskFn}
 * @param omitWhenHidden drop the key instead of masking it
 */
@Builder(toBuilder = true)
public record FieldAccessConfig(
        @Nullable PolicyCondition read,
        @Nullable PolicyCondition write,
        @Nullable UnaryOperator<Object> maskFn,
        @Nullable Object maskedValue,
        boolean omitWhenHidden
) {
}
