package com.example.rls.policy;

import com.example.rls.context.Operation;
import com.example.rls.exception.ConfigurationException;
import com.example.rls.exception.RlsErrorCode;
import lombok.Builder;
import lombok.Singular;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named bundle of policies that can be shared between tables, combined
 * with other bundles and adjusted per table.
 *
 * <pre>{@code
 * ReusablePolicy base = ReusablePolicy.compose("saas-base",
 *         PolicyPatterns.tenantIsolation(),
 *         PolicyPatterns.softDelete());
 *
 * TableSchema documents = TableSchema.builder()
 *         .include(base.extend(deny(DELETE, PolicyOptions.named("no-delete", 200))))
 *         .build();
 * }</pre>
 */
@Builder(toBuilder = true)
public record ReusablePolicy(
        String name,
        @Nullable String description,
        @Singular List<PolicyDefinition> policies,
        @Singular List<String> tags
) {
    static final int DEFAULT_DENY_PRIORITY = 100;

    public ReusablePolicy {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Reusable policy name must not be blank", RlsErrorCode.RLS_POLICY_INVALID);
        }
        policies = policies != null ? List.copyOf(policies) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static ReusablePolicy of(String name, PolicyDefinition... policies) {
        return new ReusablePolicy(name, null, Arrays.asList(policies), List.of());
    }

    // ----------------------------------------------------------------------
    // Single-policy bundles
    // ----------------------------------------------------------------------

    /**
     * Bundle holding one read filter named {@code <name>-filter}.
     */
    public static ReusablePolicy filtering(String name, FilterCondition filter) {
        return of(name, Policies.filter(Operation.READ, filter, PolicyOptions.named(name + "-filter")));
    }

    public static ReusablePolicy allowing(String name, Set<Operation> operations, PolicyCondition condition) {
        return of(name, Policies.allow(operations, condition, PolicyOptions.named(name + "-allow")));
    }

    /**
     * Bundle holding one deny policy named {@code <name>-deny}. Deny bundles
     * default to priority 100 so they outrank plain allow policies.
     */
    public static ReusablePolicy denying(String name, Set<Operation> operations, PolicyCondition condition) {
        return of(name, Policies.deny(operations, condition,
                PolicyOptions.named(name + "-deny", DEFAULT_DENY_PRIORITY)));
    }

    public static ReusablePolicy validating(String name, Operation operation, PolicyCondition condition) {
        return of(name, Policies.validate(operation, condition, PolicyOptions.named(name + "-validate")));
    }

    // ----------------------------------------------------------------------
    // Composition
    // ----------------------------------------------------------------------

    /**
     * Concatenates the policies of {@code parts} in order and unions their tags.
     */
    public static ReusablePolicy compose(String name, ReusablePolicy... parts) {
        List<PolicyDefinition> policies = new ArrayList<>();
        Set<String> tags = new LinkedHashSet<>();
        for (ReusablePolicy part : parts) {
            policies.addAll(part.policies());
            tags.addAll(part.tags());
        }
        String description = "Composed from: " + Arrays.stream(parts)
                .map(ReusablePolicy::name)
                .collect(Collectors.joining(", "));
        return new ReusablePolicy(name, description, policies, new ArrayList<>(tags));
    }

    /**
     * Copy named {@code <name>_extended} with {@code additional} appended.
     */
    public ReusablePolicy extend(PolicyDefinition... additional) {
        List<PolicyDefinition> extended = new ArrayList<>(policies);
        extended.addAll(Arrays.asList(additional));
        return new ReusablePolicy(name + "_extended", description, extended, tags);
    }

    /**
     * Copy named {@code <name>_overridden} in which every policy whose name
     * appears in {@code overrides} is replaced in place. Names with no
     * matching policy are ignored.
     */
    public ReusablePolicy override(Map<String, PolicyDefinition> overrides) {
        List<PolicyDefinition> replaced = policies.stream()
                .map(policy -> overrides.getOrDefault(policy.name(), policy))
                .toList();
        return new ReusablePolicy(name + "_overridden", description, replaced, tags);
    }

    public List<String> policyNames() {
        return policies.stream().map(PolicyDefinition::name).toList();
    }
}
