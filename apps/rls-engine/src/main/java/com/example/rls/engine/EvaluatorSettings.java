package com.example.rls.engine;

import lombok.Builder;
import lombok.Singular;

import java.util.Collection;
import java.util.Set;

/**
 * Engine-wide switches applied before any table schema is consulted.
 *
 * <p>{@code bypassRoles} skip row-level checks on every table, in addition to
 * each table's own {@code skipFor}. {@code excludeTables} are never checked:
 * reads are unfiltered and writes unguarded for every caller.
 */
@Builder(toBuilder = true)
public record EvaluatorSettings(
        boolean requireRegisteredTables,
        @Singular Set<String> bypassRoles,
        @Singular Set<String> excludeTables
) {
    public EvaluatorSettings {
        bypassRoles = bypassRoles != null ? Set.copyOf(bypassRoles) : Set.of();
        excludeTables = excludeTables != null ? Set.copyOf(excludeTables) : Set.of();
    }

    public static EvaluatorSettings defaults() {
        return new EvaluatorSettings(false, Set.of(), Set.of());
    }

    public boolean isExcluded(String table) {
        return excludeTables.contains(table);
    }

    public boolean isBypassRole(Collection<String> roles) {
        return roles != null && roles.stream().anyMatch(bypassRoles::contains);
    }
}
