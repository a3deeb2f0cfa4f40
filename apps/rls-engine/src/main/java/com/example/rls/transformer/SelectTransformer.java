package com.example.rls.transformer;

import com.example.rls.context.Operation;
import com.example.rls.context.PolicyActivationContext;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.context.RlsContext;
import com.example.rls.context.RlsContextHolder;
import com.example.rls.engine.FilterResult;
import com.example.rls.engine.PolicyEvaluator;
import com.example.rls.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Restricts a read query to the rows the caller may see.
 *
 * <p>The read decision is taken first: a denied read fails with
 * {@link AccessDeniedException} before any predicate is added, so a policy
 * failure can never look like an empty result. When allowed, every merged
 * filter condition is ANDed into the query on a table-qualified column:
 * <ul>
 *   <li>{@code null} becomes {@code IS NULL}</li>
 *   <li>a non-empty collection or array becomes {@code IN}</li>
 *   <li>an empty collection matches nothing</li>
 *   <li>anything else becomes {@code =}</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class SelectTransformer {

    private final PolicyEvaluator evaluator;

    /**
     * Transforms {@code query} using the {@link RlsContext} from the subscriber context.
     */
    public <Q extends FilterableQuery<Q>> Mono<Q> transform(Q query, String table) {
        return RlsContextHolder.getContext()
                .flatMap(rls -> transform(query, table, rls.toEvaluationContext()));
    }

    public <Q extends FilterableQuery<Q>> Mono<Q> transform(Q query, String table, PolicyEvaluationContext ctx) {
        return Mono.defer(() -> transform(query, table, ctx, evaluator.currentActivation()));
    }

    /**
     * Decision and filters are both computed against {@code activation}.
     */
    public <Q extends FilterableQuery<Q>> Mono<Q> transform(
            Q query, String table, PolicyEvaluationContext ctx, PolicyActivationContext activation) {
        return evaluator.evaluate(table, Operation.READ, ctx, activation)
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        return Mono.error(AccessDeniedException.forDecision(table, Operation.READ, decision));
                    }
                    return evaluator.getFilters(table, Operation.READ, ctx, activation)
                            .map(filters -> applyConditions(query, table, filters));
                });
    }

    private <Q extends FilterableQuery<Q>> Q applyConditions(Q query, String table, FilterResult filters) {
        Q result = query;
        for (Map.Entry<String, Object> condition : filters.conditions().entrySet()) {
            String column = table + "." + condition.getKey();
            Object value = condition.getValue();

            if (value == null) {
                result = result.where(column, FilterableQuery.OP_IS, null);
                continue;
            }
            List<?> values = asList(value);
            if (values == null) {
                result = result.where(column, FilterableQuery.OP_EQUALS, value);
            } else if (values.isEmpty()) {
                result = result.whereFalse();
            } else {
                result = result.where(column, FilterableQuery.OP_IN, values);
            }
        }
        if (!filters.appliedFilters().isEmpty()) {
            log.debug("Applied filters {} to read on {}", filters.appliedFilters(), table);
        }
        return result;
    }

    @Nullable
    private static List<?> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }
}
