package com.example.rls.context;

import com.example.rls.exception.RlsContextException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

/**
 * Ambient access to the current {@link RlsContext} through the Reactor
 * subscriber context. Its extent is exactly the subscription it was written
 * into, so concurrent pipelines never see each other's context.
 */
public final class RlsContextHolder {

    private static final String RLS_CONTEXT_KEY = RlsContext.class.getName();

    private RlsContextHolder() {
        // Utility class
    }

    public static Mono<RlsContext> getContext() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(RLS_CONTEXT_KEY)) {
                return Mono.just(ctx.get(RLS_CONTEXT_KEY));
            }
            return Mono.error(new RlsContextException());
        });
    }

    public static Mono<RlsContext> getContextIfPresent() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(RLS_CONTEXT_KEY)) {
                return Mono.just(ctx.get(RLS_CONTEXT_KEY));
            }
            return Mono.empty();
        });
    }

    public static Function<Context, Context> withContext(RlsContext rlsContext) {
        return context -> context.put(RLS_CONTEXT_KEY, rlsContext);
    }

    public static Function<Context, Context> withAuth(AuthContext auth) {
        return withContext(RlsContext.of(auth));
    }

    public static Mono<Boolean> hasContext() {
        return Mono.deferContextual(ctx -> Mono.just(ctx.hasKey(RLS_CONTEXT_KEY)));
    }
}
