package com.example.rls.policy;

import java.util.List;

/**
 * Performance hints carried alongside a policy. The engine stores them but
 * never interprets them; query layers may use them to pick indexes.
 */
public record PolicyHints(
        List<String> indexColumns,
        Selectivity selectivity,
        boolean leakproof,
        boolean stable
) {
    public enum Selectivity {
        HIGH,
        MEDIUM,
        LOW
    }

    public PolicyHints {
        indexColumns = indexColumns != null ? List.copyOf(indexColumns) : List.of();
        selectivity = selectivity != null ? selectivity : Selectivity.MEDIUM;
    }

    public static PolicyHints none() {
        return new PolicyHints(List.of(), Selectivity.MEDIUM, false, false);
    }

    public static PolicyHints indexedBy(String... columns) {
        return new PolicyHints(List.of(columns), Selectivity.HIGH, false, true);
    }
}
