package com.example.rls.util;

import com.example.rls.context.AuthContext;
import com.example.rls.context.PolicyEvaluationContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Test builder for AuthContext.
 * Provides convenient methods to create AuthContext instances for testing.
 */
public class AuthContextTestBuilder {

    private String userId = "user-1";
    private String tenantId = "tenant-1";
    private Set<String> roles = new HashSet<>(Set.of("user"));
    private boolean system = false;
    private List<String> organizationIds = new ArrayList<>();
    private Map<String, Object> attributes = new HashMap<>();

    public static AuthContextTestBuilder anAuthContext() {
        return new AuthContextTestBuilder();
    }

    public static AuthContext aUser() {
        return anAuthContext().build();
    }

    public static AuthContext anAdmin() {
        return anAuthContext()
                .withUserId("admin-1")
                .withRoles(Set.of("admin"))
                .build();
    }

    public static AuthContext aSystemUser() {
        return anAuthContext()
                .withUserId("system")
                .withTenantId(null)
                .withRoles(Set.of())
                .asSystem()
                .build();
    }

    public AuthContextTestBuilder withUserId(String userId) {
        this.userId = userId;
        return this;
    }

    public AuthContextTestBuilder withTenantId(String tenantId) {
        this.tenantId = tenantId;
        return this;
    }

    public AuthContextTestBuilder withRoles(Set<String> roles) {
        this.roles = new HashSet<>(roles);
        return this;
    }

    public AuthContextTestBuilder withRole(String role) {
        this.roles.add(role);
        return this;
    }

    public AuthContextTestBuilder withOrganizationIds(List<String> organizationIds) {
        this.organizationIds = new ArrayList<>(organizationIds);
        return this;
    }

    public AuthContextTestBuilder withAttribute(String key, Object value) {
        this.attributes.put(key, value);
        return this;
    }

    public AuthContextTestBuilder asSystem() {
        this.system = true;
        return this;
    }

    public AuthContext build() {
        return new AuthContext(userId, tenantId, roles, system, organizationIds, attributes);
    }

    public PolicyEvaluationContext buildEvaluationContext() {
        return PolicyEvaluationContext.of(build());
    }
}
