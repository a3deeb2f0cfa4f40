package com.example.rls.context;

import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Caller identity for one logical operation. Built per request by the host
 * application and never mutated afterwards.
 */
public record AuthContext(
        String userId,
        @Nullable String tenantId,
        Set<String> roles,
        boolean system,
        List<String> organizationIds,
        Map<String, Object> attributes
) {
    public AuthContext {
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        organizationIds = organizationIds != null ? List.copyOf(organizationIds) : List.of();
        attributes = ContextMaps.copyOrEmpty(attributes);
    }

    public static AuthContext forUser(String userId, @Nullable String tenantId, Set<String> roles) {
        return new AuthContext(userId, tenantId, roles, false, List.of(), Map.of());
    }

    /**
     * Trusted internal caller. Bypasses every row and field check.
     */
    public static AuthContext system(String userId) {
        return new AuthContext(userId, null, Set.of(), true, List.of(), Map.of());
    }

    public boolean hasRole(String role) {
        return role != null && roles.contains(role);
    }

    public boolean hasAnyRole(Collection<String> candidates) {
        return candidates != null && candidates.stream().anyMatch(roles::contains);
    }
}
