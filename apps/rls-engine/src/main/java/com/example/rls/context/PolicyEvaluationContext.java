package com.example.rls.context;

import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of a single policy evaluation.
 *
 * <p>{@code row} is the existing row (read/update/delete), {@code data} the
 * proposed write payload (create/update) and {@code meta} free-form data
 * injected by collaborators that run before evaluation, such as context
 * resolvers or relationship checks. Maps keep insertion order and are exposed
 * read-only.
 */
public record PolicyEvaluationContext(
        AuthContext auth,
        @Nullable String table,
        @Nullable Operation operation,
        @Nullable Map<String, Object> row,
        @Nullable Map<String, Object> data,
        Map<String, Object> meta
) {
    public PolicyEvaluationContext {
        if (auth == null) {
            throw new IllegalArgumentException("auth must not be null");
        }
        row = ContextMaps.copyOrNull(row);
        data = ContextMaps.copyOrNull(data);
        meta = ContextMaps.copyOrEmpty(meta);
    }

    public static PolicyEvaluationContext of(AuthContext auth) {
        return new PolicyEvaluationContext(auth, null, null, null, null, Map.of());
    }

    public PolicyEvaluationContext forTable(String table, Operation operation) {
        return new PolicyEvaluationContext(auth, table, operation, row, data, meta);
    }

    public PolicyEvaluationContext withRow(@Nullable Map<String, Object> row) {
        return new PolicyEvaluationContext(auth, table, operation, row, data, meta);
    }

    public PolicyEvaluationContext withData(@Nullable Map<String, Object> data) {
        return new PolicyEvaluationContext(auth, table, operation, row, data, meta);
    }

    public PolicyEvaluationContext withMeta(Map<String, Object> meta) {
        return new PolicyEvaluationContext(auth, table, operation, row, data, meta);
    }

    public PolicyEvaluationContext withMetaEntry(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(meta);
        merged.put(key, value);
        return withMeta(merged);
    }

    /**
     * Value of {@code column} in the existing row, or {@code null}.
     */
    @Nullable
    public Object rowValue(String column) {
        return row != null ? row.get(column) : null;
    }

    /**
     * Value of {@code column} in the write payload, or {@code null}.
     */
    @Nullable
    public Object dataValue(String column) {
        return data != null ? data.get(column) : null;
    }

    @Nullable
    public Object metaValue(String key) {
        return meta.get(key);
    }
}
