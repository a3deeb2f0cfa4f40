package com.example.rls.guard;

import com.example.rls.context.Operation;
import com.example.rls.context.PolicyActivationContext;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.context.RlsContextHolder;
import com.example.rls.engine.PolicyEvaluator;
import com.example.rls.exception.AccessDeniedException;
import com.example.rls.exception.PolicyEvaluationException;
import com.example.rls.exception.RlsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Gates create, update and delete before they reach storage.
 *
 * <p>A denied decision fails with {@link AccessDeniedException} carrying the
 * evaluation trace; create and update additionally run the table's validate
 * policies. Unexpected failures inside the check become
 * {@link PolicyEvaluationException}, so the mutation never runs unless the
 * guard completed successfully.
 */
@Slf4j
@RequiredArgsConstructor
public class MutationGuard {

    private final PolicyEvaluator evaluator;

    public Mono<Void> checkCreate(String table, Map<String, Object> data, PolicyEvaluationContext ctx) {
        return check(table, Operation.CREATE, ctx.withRow(null).withData(data));
    }

    public Mono<Void> checkUpdate(
            String table,
            @Nullable Map<String, Object> existingRow,
            Map<String, Object> data,
            PolicyEvaluationContext ctx) {
        return check(table, Operation.UPDATE, ctx.withRow(existingRow).withData(data));
    }

    public Mono<Void> checkDelete(String table, @Nullable Map<String, Object> existingRow, PolicyEvaluationContext ctx) {
        return check(table, Operation.DELETE, ctx.withRow(existingRow).withData(null));
    }

    /**
     * Checks a mutation using the {@code RlsContext} from the subscriber context.
     */
    public Mono<Void> check(
            String table,
            Operation operation,
            @Nullable Map<String, Object> existingRow,
            @Nullable Map<String, Object> data) {
        return RlsContextHolder.getContext()
                .flatMap(rls -> check(table, operation,
                        rls.toEvaluationContext().withRow(existingRow).withData(data)));
    }

    /**
     * Checks {@code operation} on {@code table}. {@code ctx.row()} is the
     * pre-mutation row, {@code ctx.data()} the proposed payload.
     */
    public Mono<Void> check(String table, Operation operation, PolicyEvaluationContext ctx) {
        if (!operation.isMutation()) {
            return Mono.error(new IllegalArgumentException(
                    "MutationGuard only handles CREATE, UPDATE and DELETE, got " + operation));
        }

        Mono<Void> checks = Mono.defer(() -> {
            PolicyActivationContext activation = evaluator.currentActivation();
            Mono<Void> decision = evaluator.evaluate(table, operation, ctx, activation)
                    .flatMap(result -> {
                        if (!result.allowed()) {
                            log.debug("Blocked {} on {}: {}", operation.value(), table, result.reason());
                            return Mono.<Void>error(AccessDeniedException.forDecision(table, operation, result));
                        }
                        return Mono.<Void>empty();
                    });
            return operation.isWrite()
                    ? decision.then(evaluator.validateWrite(table, operation, ctx, activation))
                    : decision;
        });

        return checks.onErrorMap(error -> !(error instanceof RlsException),
                error -> new PolicyEvaluationException(table, null,
                        "mutation guard failed for " + operation.value() + ": " + error.getMessage(), error));
    }

    /**
     * Runs {@code mutation} only after the guard for {@code operation} completed.
     */
    public <T> Mono<T> guarded(
            String table,
            Operation operation,
            PolicyEvaluationContext ctx,
            Supplier<Mono<T>> mutation) {
        return check(table, operation, ctx).then(Mono.defer(mutation));
    }
}
