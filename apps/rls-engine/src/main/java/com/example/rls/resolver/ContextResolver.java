package com.example.rls.resolver;

import com.example.rls.context.AuthContext;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * Loads request-scoped data that policies need but the caller does not carry,
 * such as organization memberships or tenant settings. The result is exposed to
 * predicates as {@code ctx.meta()[name()]}.
 */
public interface ContextResolver {

    String name();

    Mono<Map<String, Object>> resolve(AuthContext auth);

    /**
     * Cache key for the result, or empty to resolve on every request. Keys
     * only need to be unique per resolver; the manager namespaces them by {@link #name()}.
     */
    default Optional<String> cacheKey(AuthContext auth) {
        return Optional.empty();
    }

    /**
     * A failing required resolver fails the whole resolution; an optional one is skipped.
     */
    default boolean required() {
        return true;
    }
}
