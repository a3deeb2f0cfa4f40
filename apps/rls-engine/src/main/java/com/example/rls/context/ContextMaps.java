package com.example.rls.context;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only, insertion-ordered copies of the free-form maps carried by the
 * context records. {@code Map.copyOf} rejects null values, while rows,
 * feature flags, attributes and resolver metadata may all contain them.
 */
final class ContextMaps {

    private ContextMaps() {
    }

    @Nullable
    static Map<String, Object> copyOrNull(@Nullable Map<String, Object> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : null;
    }

    static Map<String, Object> copyOrEmpty(@Nullable Map<String, Object> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }
}
