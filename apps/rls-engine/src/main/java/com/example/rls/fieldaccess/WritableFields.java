package com.example.rls.fieldaccess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write payload with the fields the caller may not write removed.
 */
public record WritableFields(
        Map<String, Object> data,
        List<String> removedFields
) {
    public WritableFields {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        removedFields = List.copyOf(removedFields);
    }
}
