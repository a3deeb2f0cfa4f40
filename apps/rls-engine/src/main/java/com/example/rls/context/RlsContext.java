package com.example.rls.context;

import java.util.Map;

/**
 * Request-scoped auth plus metadata, as carried by {@link RlsContextHolder}.
 */
public record RlsContext(
        AuthContext auth,
        Map<String, Object> meta
) {
    public RlsContext {
        meta = ContextMaps.copyOrEmpty(meta);
    }

    public static RlsContext of(AuthContext auth) {
        return new RlsContext(auth, Map.of());
    }

    public PolicyEvaluationContext toEvaluationContext() {
        return PolicyEvaluationContext.of(auth).withMeta(meta);
    }
}
