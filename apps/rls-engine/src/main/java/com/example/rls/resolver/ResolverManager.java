package com.example.rls.resolver;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.config.RlsProperties.ResolverCacheProperties;
import com.example.rls.context.AuthContext;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.context.RlsContext;
import com.example.rls.exception.ConfigurationException;
import com.example.rls.exception.ContextResolutionException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the registered {@link ContextResolver}s in registration order and
 * injects each result into the evaluation context's {@code meta} under the
 * resolver's name.
 *
 * <p>Results with a cache key are kept in a Caffeine cache that expires
 * entries after a fixed TTL. Entries are stored under the resolver's name
 * plus its key, so two resolvers keyed by user id never share an entry. Nothing invalidates an entry on write, so a
 * policy may see data up to one TTL old.
 */
@Slf4j
public class ResolverManager {

    private final Map<String, ContextResolver> resolvers = new LinkedHashMap<>();
    private final Cache<String, Map<String, Object>> cache;

    public ResolverManager(ResolverCacheProperties cacheProperties) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheProperties.ttl())
                .maximumSize(cacheProperties.maxEntries())
                .build();
        log.info("Context resolver cache initialized (ttl={}, max-entries={})",
                cacheProperties.ttl(), cacheProperties.maxEntries());
    }

    public ResolverManager(ResolverCacheProperties cacheProperties, List<ContextResolver> resolvers) {
        this(cacheProperties);
        resolvers.forEach(this::register);
    }

    public synchronized void register(ContextResolver resolver) {
        if (resolver.name() == null || resolver.name().isBlank()) {
            throw new ConfigurationException("Context resolver name must not be blank");
        }
        if (resolvers.putIfAbsent(resolver.name(), resolver) != null) {
            throw new ConfigurationException("Resolver '" + resolver.name() + "' is already registered");
        }
        log.info("Registered context resolver {}", resolver.name());
    }

    public synchronized boolean hasResolver(String name) {
        return resolvers.containsKey(name);
    }

    public synchronized List<String> getResolverNames() {
        return List.copyOf(resolvers.keySet());
    }

    /**
     * Returns {@code ctx} with every resolver's result added to its meta.
     * Resolvers run one after another; none overlaps another.
     */
    public Mono<PolicyEvaluationContext> resolve(PolicyEvaluationContext ctx) {
        return Flux.fromIterable(snapshot())
                .concatMap(resolver -> resolveOne(resolver, ctx.auth())
                        .map(data -> Map.entry(resolver.name(), data)))
                .reduce(ctx, (current, entry) -> current.withMetaEntry(entry.getKey(), entry.getValue()));
    }

    /**
     * Builds the ambient {@link RlsContext} for {@code auth} with resolved data as meta.
     */
    public Mono<RlsContext> resolve(AuthContext auth) {
        return resolve(PolicyEvaluationContext.of(auth))
                .map(ctx -> new RlsContext(auth, ctx.meta()));
    }

    public void invalidate(String resolverName, String cacheKey) {
        cache.invalidate(entryKey(resolverName, cacheKey));
        log.debug("Invalidated {} cache entry {}", resolverName, StringSanitizer.forLog(cacheKey));
    }

    public void clearCache() {
        cache.invalidateAll();
        log.info("Cleared context resolver cache");
    }

    long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static String entryKey(String resolverName, String cacheKey) {
        return resolverName + ":" + cacheKey;
    }

    private synchronized List<ContextResolver> snapshot() {
        return new ArrayList<>(resolvers.values());
    }

    private Mono<Map<String, Object>> resolveOne(ContextResolver resolver, AuthContext auth) {
        Optional<String> key = resolver.cacheKey(auth).map(k -> entryKey(resolver.name(), k));
        if (key.isPresent()) {
            Map<String, Object> cached = cache.getIfPresent(key.get());
            if (cached != null) {
                log.debug("Resolver cache hit for {}", resolver.name());
                return Mono.just(cached);
            }
        }
        return Mono.defer(() -> resolver.resolve(auth))
                .doOnNext(data -> key.ifPresent(k -> cache.put(k, data)))
                .onErrorResume(error -> {
                    if (resolver.required()) {
                        return Mono.error(new ContextResolutionException(resolver.name(), error));
                    }
                    log.warn("Optional context resolver {} failed, skipping: {}",
                            resolver.name(), StringSanitizer.forLog(error.getMessage()));
                    return Mono.empty();
                });
    }
}
