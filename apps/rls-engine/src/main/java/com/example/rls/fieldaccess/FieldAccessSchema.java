package com.example.rls.fieldaccess;

import com.example.rls.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative field-level schema: table name to {@link TableFieldAccessConfig}.
 */
public record FieldAccessSchema(Map<String, TableFieldAccessConfig> tables) {

    public FieldAccessSchema {
        tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static FieldAccessSchema defineFieldAccessSchema(Map<String, TableFieldAccessConfig> tables) {
        return new FieldAccessSchema(tables);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, TableFieldAccessConfig> tables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder table(String table, TableFieldAccessConfig config) {
            if (table == null || table.isBlank()) {
                throw new ConfigurationException("Table name must not be blank");
            }
            if (tables.putIfAbsent(table, config) != null) {
                throw new ConfigurationException("Field access for table '" + table + "' is declared twice");
            }
            return this;
        }

        public FieldAccessSchema build() {
            return new FieldAccessSchema(tables);
        }
    }
}
