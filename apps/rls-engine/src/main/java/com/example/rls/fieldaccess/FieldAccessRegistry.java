package com.example.rls.fieldaccess;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.exception.ConfigurationException;
import com.example.rls.policy.PolicyCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled field-level rules, keyed by table.
 *
 * <p>Tables without field rules, and fields a table does not mention, fall back
 * to open access or to the table's {@link FieldAccessDefault}. A rule whose
 * predicate throws denies access.
 */
@Slf4j
public class FieldAccessRegistry {

    private final Map<String, CompiledTableFieldAccess> tables = new ConcurrentHashMap<>();

    public FieldAccessRegistry() {
    }

    public FieldAccessRegistry(FieldAccessSchema schema) {
        loadSchema(schema);
    }

    public void loadSchema(FieldAccessSchema schema) {
        schema.tables().forEach(this::registerTable);
    }

    public synchronized void registerTable(String table, TableFieldAccessConfig config) {
        if (tables.containsKey(table)) {
            throw new ConfigurationException("Field access for table '" + table + "' is already registered");
        }
        Map<String, CompiledFieldAccess> fields = new LinkedHashMap<>();
        config.fields().forEach((field, fieldConfig) ->
                fields.put(field, CompiledFieldAccess.compile(field, fieldConfig)));

        tables.put(table, new CompiledTableFieldAccess(
                table, config.defaultAccess(), config.skipFor(), Collections.unmodifiableMap(fields)));
        log.info("Registered field access for table {}: {} field rules, default {}",
                table, fields.size(), config.defaultAccess());
    }

    public Optional<CompiledTableFieldAccess> getTable(String table) {
        return Optional.ofNullable(tables.get(table));
    }

    public boolean hasTable(String table) {
        return tables.containsKey(table);
    }

    /**
     * Whether the caller may see {@code field}. {@code ctx.row()} is the row being read.
     */
    public boolean canReadField(String table, String field, PolicyEvaluationContext ctx) {
        return check(table, field, ctx, true);
    }

    /**
     * Whether the caller may write {@code field}. {@code ctx.row()} is the existing
     * row, {@code ctx.data()} the proposed payload.
     */
    public boolean canWriteField(String table, String field, PolicyEvaluationContext ctx) {
        return check(table, field, ctx, false);
    }

    @Nullable
    CompiledFieldAccess fieldRule(String table, String field) {
        CompiledTableFieldAccess compiled = tables.get(table);
        return compiled != null ? compiled.field(field).orElse(null) : null;
    }

    private boolean check(String table, String field, PolicyEvaluationContext ctx, boolean read) {
        CompiledTableFieldAccess compiled = tables.get(table);
        if (compiled == null || ctx.auth().system() || compiled.isSkippedFor(ctx.auth().roles())) {
            return true;
        }
        Optional<CompiledFieldAccess> configured = compiled.field(field);
        if (configured.isEmpty()) {
            return compiled.defaultAccess() == FieldAccessDefault.ALLOW;
        }
        CompiledFieldAccess rule = configured.get();
        PolicyCondition condition = read ? rule.canRead() : rule.canWrite();
        try {
            return condition.test(ctx);
        } catch (RuntimeException e) {
            log.debug("Field {} {}.{} check failed, denying: {}",
                    read ? "read" : "write", table, field, StringSanitizer.forLog(e.getMessage()));
            return false;
        }
    }
}
