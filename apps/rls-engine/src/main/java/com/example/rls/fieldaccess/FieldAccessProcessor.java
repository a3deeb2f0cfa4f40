package com.example.rls.fieldaccess;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.context.Operation;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.context.RlsContextHolder;
import com.example.rls.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies field rules to rows on the way out and to payloads on the way in.
 */
@Slf4j
@RequiredArgsConstructor
public class FieldAccessProcessor {

    private final FieldAccessRegistry registry;

    // ----------------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------------

    public Mono<MaskedRow> maskRow(String table, Map<String, Object> row) {
        return maskRow(table, row, MaskOptions.defaults());
    }

    public Mono<MaskedRow> maskRow(String table, Map<String, Object> row, MaskOptions options) {
        return RlsContextHolder.getContext()
                .flatMap(rls -> maskRow(table, row, rls.toEvaluationContext(), options));
    }

    /**
     * Masks every field of {@code row} the caller may not read. Hidden fields
     * are dropped when their rule says {@code omitWhenHidden}; otherwise they are
     * replaced by {@code maskFn(value)}, the rule's masked value, or {@code null}.
     */
    public Mono<MaskedRow> maskRow(
            String table, Map<String, Object> row, PolicyEvaluationContext ctx, MaskOptions options) {
        return Mono.fromCallable(() -> doMaskRow(table, row, ctx.forTable(table, Operation.READ).withRow(row), options));
    }

    /**
     * Masks each row independently; output order matches input order.
     */
    public Mono<List<MaskedRow>> maskRows(
            String table, List<Map<String, Object>> rows, PolicyEvaluationContext ctx, MaskOptions options) {
        return Flux.fromIterable(rows)
                .concatMap(row -> maskRow(table, row, ctx, options))
                .collectList();
    }

    public Mono<List<MaskedRow>> maskRows(String table, List<Map<String, Object>> rows) {
        return RlsContextHolder.getContext()
                .flatMap(rls -> maskRows(table, rows, rls.toEvaluationContext(), MaskOptions.defaults()));
    }

    public Mono<List<String>> getReadableFields(String table, Map<String, Object> row, PolicyEvaluationContext ctx) {
        return Mono.fromCallable(() -> {
            PolicyEvaluationContext readCtx = ctx.forTable(table, Operation.READ).withRow(row);
            return row.keySet().stream()
                    .filter(field -> registry.canReadField(table, field, readCtx))
                    .toList();
        });
    }

    // ----------------------------------------------------------------------
    // Writes
    // ----------------------------------------------------------------------

    /**
     * Fails with {@link AccessDeniedException} naming the first field of
     * {@code data}, in payload order, that the caller may not write.
     * {@code ctx.row()} is the existing row, if any.
     */
    public Mono<Void> validateWrite(String table, Map<String, Object> data, PolicyEvaluationContext ctx) {
        return Mono.defer(() -> {
            Operation operation = writeOperation(ctx);
            PolicyEvaluationContext writeCtx = ctx.forTable(table, operation).withData(data);
            for (String field : data.keySet()) {
                if (!registry.canWriteField(table, field, writeCtx)) {
                    log.debug("Write to protected field {}.{} rejected for user {}",
                            table, field, StringSanitizer.forLog(ctx.auth().userId()));
                    return Mono.error(AccessDeniedException.forField(table, operation, field));
                }
            }
            return Mono.empty();
        });
    }

    public Mono<Void> validateWrite(String table, Map<String, Object> data, @Nullable Map<String, Object> existingRow) {
        return RlsContextHolder.getContext()
                .flatMap(rls -> validateWrite(table, data, rls.toEvaluationContext().withRow(existingRow)));
    }

    /**
     * Drops the fields the caller may not write instead of failing.
     */
    public Mono<WritableFields> filterWritableFields(
            String table, Map<String, Object> data, PolicyEvaluationContext ctx) {
        return Mono.fromCallable(() -> {
            PolicyEvaluationContext writeCtx = ctx.forTable(table, writeOperation(ctx)).withData(data);
            Map<String, Object> allowed = new LinkedHashMap<>();
            List<String> removed = new ArrayList<>();
            data.forEach((field, value) -> {
                if (registry.canWriteField(table, field, writeCtx)) {
                    allowed.put(field, value);
                } else {
                    removed.add(field);
                }
            });
            return new WritableFields(allowed, removed);
        });
    }

    public Mono<List<String>> getWritableFields(String table, Map<String, Object> data, PolicyEvaluationContext ctx) {
        return filterWritableFields(table, data, ctx)
                .map(result -> List.copyOf(result.data().keySet()));
    }

    // ----------------------------------------------------------------------
    // helpers
    // ----------------------------------------------------------------------

    private MaskedRow doMaskRow(
            String table, Map<String, Object> row, PolicyEvaluationContext ctx, MaskOptions options) {
        Map<String, Object> out = new LinkedHashMap<>();
        List<String> masked = new ArrayList<>();
        List<String> omitted = new ArrayList<>();

        for (Map.Entry<String, Object> entry : row.entrySet()) {
            String field = entry.getKey();
            if (!options.isProjected(field)) {
                continue;
            }
            if (registry.canReadField(table, field, ctx)) {
                out.put(field, entry.getValue());
                continue;
            }
            if (options.throwOnDenied()) {
                throw AccessDeniedException.forField(table, Operation.READ, field);
            }
            CompiledFieldAccess rule = registry.fieldRule(table, field);
            if (rule != null && rule.omitWhenHidden()) {
                omitted.add(field);
            } else {
                out.put(field, maskedValue(table, rule, entry.getValue()));
                masked.add(field);
            }
        }
        return new MaskedRow(out, masked, omitted);
    }

    // A mask function that throws must not leak the real value.
    @Nullable
    private static Object maskedValue(String table, @Nullable CompiledFieldAccess rule, @Nullable Object value) {
        if (rule == null) {
            return null;
        }
        if (rule.maskFn() != null) {
            try {
                return rule.maskFn().apply(value);
            } catch (RuntimeException e) {
                log.debug("Mask function for {}.{} failed: {}",
                        table, rule.field(), StringSanitizer.forLog(e.getMessage()));
                return null;
            }
        }
        return rule.maskedValue();
    }

    private static Operation writeOperation(PolicyEvaluationContext ctx) {
        if (ctx.operation() != null && ctx.operation().isWrite()) {
            return ctx.operation();
        }
        return ctx.row() != null ? Operation.UPDATE : Operation.CREATE;
    }
}
