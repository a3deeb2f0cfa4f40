package com.example.rls.fieldaccess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row after masking. {@code maskedFields} were replaced, {@code omittedFields} removed.
 */
public record MaskedRow(
        Map<String, Object> data,
        List<String> maskedFields,
        List<String> omittedFields
) {
    public MaskedRow {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        maskedFields = List.copyOf(maskedFields);
        omittedFields = List.copyOf(omittedFields);
    }

    public boolean isMasked(String field) {
        return maskedFields.contains(field);
    }

    public boolean isOmitted(String field) {
        return omittedFields.contains(field);
    }
}
