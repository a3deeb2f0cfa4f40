package com.example.rls.fieldaccess;

import lombok.Builder;
import lombok.Singular;

import java.util.Set;

/**
 * Projection and strictness for {@link FieldAccessProcessor#maskRow}.
 *
 * @param includeFields  when non-empty, only these keys are considered
 * @param excludeFields  keys left out of the result entirely
 * @param throwOnDenied  fail with {@code AccessDeniedException} instead of masking
 */
@Builder
public record MaskOptions(
        @Singular("include") Set<String> includeFields,
        @Singular("exclude") Set<String> excludeFields,
        boolean throwOnDenied
) {
    public MaskOptions {
        includeFields = includeFields != null ? Set.copyOf(includeFields) : Set.of();
        excludeFields = excludeFields != null ? Set.copyOf(excludeFields) : Set.of();
    }

    public static MaskOptions defaults() {
        return new MaskOptions(Set.of(), Set.of(), false);
    }

    boolean isProjected(String field) {
        if (excludeFields.contains(field)) {
            return false;
        }
        return includeFields.isEmpty() || includeFields.contains(field);
    }
}
