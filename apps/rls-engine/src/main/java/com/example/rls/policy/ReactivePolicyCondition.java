package com.example.rls.policy;

import com.example.rls.context.PolicyEvaluationContext;
import reactor.core.publisher.Mono;

/**
 * Predicate that may need to await an external lookup before answering.
 * An empty result counts as {@code false}.
 */
@FunctionalInterface
public interface ReactivePolicyCondition {

    Mono<Boolean> evaluate(PolicyEvaluationContext ctx);

    /**
     * Adapts a synchronous condition. Exceptions thrown by the condition
     * surface as an error signal rather than escaping the call.
     */
    static ReactivePolicyCondition of(PolicyCondition condition) {
        return ctx -> Mono.fromCallable(() -> condition.test(ctx));
    }
}
