package com.example.rls.policy;

import com.example.rls.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative row-level security schema: table name to {@link TableSchema}.
 * Expose one or more of these as beans and the auto-configuration registers them.
 */
public record RlsSchema(Map<String, TableSchema> tables) {

    public RlsSchema {
        tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static RlsSchema defineSchema(Map<String, TableSchema> tables) {
        return new RlsSchema(tables);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, TableSchema> tables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder table(String table, TableSchema schema) {
            if (table == null || table.isBlank()) {
                throw new ConfigurationException("Table name must not be blank");
            }
            if (tables.putIfAbsent(table, schema) != null) {
                throw new ConfigurationException("Table '" + table + "' is declared twice in the same schema");
            }
            return this;
        }

        public RlsSchema build() {
            return new RlsSchema(tables);
        }
    }
}
