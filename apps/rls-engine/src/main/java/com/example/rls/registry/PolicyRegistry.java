package com.example.rls.registry;

import com.example.rls.context.Operation;
import com.example.rls.exception.ConfigurationException;
import com.example.rls.policy.DecisionType;
import com.example.rls.policy.PolicyDefinition;
import com.example.rls.policy.RlsSchema;
import com.example.rls.policy.TableSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per-table store of compiled policies.
 *
 * <p>Populated once at startup and read-only afterwards; lookups are safe from
 * any number of threads. Every registration mistake raises
 * {@link ConfigurationException} immediately.
 */
@Slf4j
public class PolicyRegistry {

    private final Map<String, CompiledTable> tables = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new ArrayList<>();

    public PolicyRegistry() {
    }

    public PolicyRegistry(RlsSchema schema) {
        loadSchema(schema);
    }

    public void loadSchema(RlsSchema schema) {
        schema.tables().forEach(this::register);
    }

    public synchronized void register(String table, TableSchema schema) {
        if (table == null || table.isBlank()) {
            throw new ConfigurationException("Table name must not be blank");
        }
        if (schema == null) {
            throw new ConfigurationException("Schema for table '" + table + "' must not be null");
        }
        if (tables.containsKey(table)) {
            throw new ConfigurationException("Table '" + table + "' is already registered");
        }

        Set<String> seen = new HashSet<>();
        for (PolicyDefinition policy : schema.policies()) {
            if (!seen.add(policy.name())) {
                throw new ConfigurationException(
                        String.format("Duplicate policy name '%s' on table '%s'", policy.name(), table));
            }
        }

        // List.sort is stable: equal priorities keep declaration order
        List<PolicyDefinition> sorted = new ArrayList<>(schema.policies());
        sorted.sort(Comparator.comparingInt(PolicyDefinition::priority).reversed());

        tables.put(table, new CompiledTable(table, sorted, schema.defaultDeny(), schema.skipFor()));
        registrationOrder.add(table);

        log.info("Registered RLS table {} with {} policies (defaultDeny={}, skipFor={})",
                table, sorted.size(), schema.defaultDeny(), schema.skipFor());
        sorted.forEach(p -> log.debug("  - {} {} (priority={}, operations={})",
                p.decisionType().value(), p.name(), p.priority(), p.operations()));
    }

    /**
     * Policies of {@code table} that target {@code operation} or ALL, in priority order.
     */
    public List<PolicyDefinition> getPoliciesFor(String table, Operation operation) {
        CompiledTable compiled = tables.get(table);
        if (compiled == null) {
            return List.of();
        }
        return compiled.policies().stream()
                .filter(p -> p.appliesTo(operation))
                .toList();
    }

    public List<PolicyDefinition> getPoliciesFor(String table, Operation operation, DecisionType type) {
        return getPoliciesFor(table, operation).stream()
                .filter(p -> p.decisionType() == type)
                .toList();
    }

    public Optional<PolicyDefinition> findPolicy(String table, String policyName) {
        CompiledTable compiled = tables.get(table);
        if (compiled == null) {
            return Optional.empty();
        }
        return compiled.policies().stream()
                .filter(p -> p.name().equals(policyName))
                .findFirst();
    }

    public Optional<CompiledTable> getTable(String table) {
        return Optional.ofNullable(tables.get(table));
    }

    public boolean hasTable(String table) {
        return tables.containsKey(table);
    }

    public synchronized List<String> getTables() {
        return List.copyOf(registrationOrder);
    }

    public Set<String> getSkipFor(String table) {
        CompiledTable compiled = tables.get(table);
        return compiled != null ? compiled.skipFor() : Set.of();
    }

    public boolean isDefaultDeny(String table) {
        CompiledTable compiled = tables.get(table);
        return compiled != null && compiled.defaultDeny();
    }

    public PolicyListing listPolicies(String table) {
        CompiledTable compiled = tables.get(table);
        if (compiled == null) {
            return new PolicyListing(List.of(), List.of(), List.of(), List.of());
        }
        Map<DecisionType, List<String>> byType = compiled.policies().stream()
                .collect(Collectors.groupingBy(PolicyDefinition::decisionType,
                        Collectors.mapping(PolicyDefinition::name, Collectors.toList())));
        return new PolicyListing(
                byType.getOrDefault(DecisionType.ALLOW, List.of()),
                byType.getOrDefault(DecisionType.DENY, List.of()),
                byType.getOrDefault(DecisionType.FILTER, List.of()),
                byType.getOrDefault(DecisionType.VALIDATE, List.of()));
    }
}
