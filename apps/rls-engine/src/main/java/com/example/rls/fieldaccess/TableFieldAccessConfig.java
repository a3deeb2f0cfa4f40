package com.example.rls.fieldaccess;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Field rules of one table. Fields without a rule fall back to {@code defaultAccess}.
 */
@Builder(toBuilder = true)
public record TableFieldAccessConfig(
        FieldAccessDefault defaultAccess,
        @Singular("skipForRole") Set<String> skipFor,
        @Singular Map<String, FieldAccessConfig> fields
) {
    public TableFieldAccessConfig {
        defaultAccess = defaultAccess != null ? defaultAccess : FieldAccessDefault.ALLOW;
        skipFor = skipFor != null ? Set.copyOf(skipFor) : Set.of();
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }
}
