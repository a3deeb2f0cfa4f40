package com.example.rls.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged filter conditions and the names of the filters that produced them,
 * in the order they were applied.
 */
public record FilterResult(
        Map<String, Object> conditions,
        List<String> appliedFilters
) {
    public FilterResult {
        // values may be null (IS NULL), so Map.copyOf is not an option
        conditions = Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
        appliedFilters = List.copyOf(appliedFilters);
    }

    public static FilterResult empty() {
        return new FilterResult(Map.of(), List.of());
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
