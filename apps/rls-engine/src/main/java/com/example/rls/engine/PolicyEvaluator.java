package com.example.rls.engine;

import com.example.rls.audit.RlsAuditLogger;
import com.example.rls.common.util.StringSanitizer;
import com.example.rls.context.Operation;
import com.example.rls.context.PolicyActivationContext;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.exception.PolicyEvaluationException;
import com.example.rls.exception.PredicateException;
import com.example.rls.exception.ValidationException;
import com.example.rls.policy.ConditionPolicy;
import com.example.rls.policy.DecisionType;
import com.example.rls.policy.FilterPolicy;
import com.example.rls.policy.PolicyDefinition;
import com.example.rls.registry.CompiledTable;
import com.example.rls.registry.PolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row-level decision engine.
 *
 * <p>Combining algorithm for {@link #evaluate}: first applicable.
 * <ul>
 *   <li>excluded tables are never checked</li>
 *   <li>system callers, global bypass roles and the table's {@code skipFor} roles bypass every policy</li>
 *   <li>active allow/deny policies are checked one at a time in priority order</li>
 *   <li>the first predicate returning {@code true} decides</li>
 *   <li>a predicate that throws is traced as a non-match</li>
 *   <li>if nothing matches, the table's {@code defaultDeny} decides</li>
 * </ul>
 *
 * <p>Stateless apart from the read-only registry: every call works on the
 * context it is given, so one instance serves any number of concurrent requests.
 */
@Slf4j
public class PolicyEvaluator {

    private final PolicyRegistry registry;
    private final ActivationContextProvider activationProvider;
    @Nullable
    private final RlsAuditLogger auditLogger;
    private final EvaluatorSettings settings;

    public PolicyEvaluator(PolicyRegistry registry, ActivationContextProvider activationProvider) {
        this(registry, activationProvider, null, EvaluatorSettings.defaults());
    }

    public PolicyEvaluator(
            PolicyRegistry registry,
            ActivationContextProvider activationProvider,
            @Nullable RlsAuditLogger auditLogger,
            EvaluatorSettings settings) {
        this.registry = registry;
        this.activationProvider = activationProvider;
        this.auditLogger = auditLogger;
        this.settings = settings != null ? settings : EvaluatorSettings.defaults();
    }

    /**
     * Reads the activation context once, so callers that combine several
     * evaluations (decision plus filters, decision plus validation) see the
     * same environment, flags and clock reading.
     */
    public PolicyActivationContext currentActivation() {
        return activationProvider.current();
    }

    // ----------------------------------------------------------------------
    // evaluate
    // ----------------------------------------------------------------------

    public Mono<EvaluationResult> evaluate(String table, Operation operation, PolicyEvaluationContext ctx) {
        return Mono.defer(() -> evaluate(table, operation, ctx, activationProvider.current()));
    }

    public Mono<EvaluationResult> evaluate(
            String table,
            Operation operation,
            PolicyEvaluationContext ctx,
            PolicyActivationContext activation) {

        PolicyEvaluationContext evalCtx = ctx.forTable(table, operation);

        if (settings.isExcluded(table)) {
            return Mono.just(EvaluationResult.bypass(EvaluationResult.REASON_EXCLUDED_TABLE));
        }
        if (evalCtx.auth().system()) {
            return Mono.just(audited(table, operation, evalCtx,
                    EvaluationResult.bypass(EvaluationResult.REASON_SYSTEM_BYPASS)));
        }
        if (settings.isBypassRole(evalCtx.auth().roles())) {
            return Mono.just(audited(table, operation, evalCtx,
                    EvaluationResult.bypass(EvaluationResult.REASON_BYPASS_ROLE)));
        }

        Optional<CompiledTable> compiled = registry.getTable(table);
        if (compiled.isEmpty()) {
            EvaluationResult result = EvaluationResult.fallback(
                    settings.requireRegisteredTables(), EvaluationResult.REASON_NO_POLICIES, List.of());
            return Mono.just(audited(table, operation, evalCtx, result));
        }

        if (compiled.get().isSkippedFor(evalCtx.auth().roles())) {
            return Mono.just(audited(table, operation, evalCtx,
                    EvaluationResult.bypass(EvaluationResult.REASON_SKIP_FOR_ROLE)));
        }

        List<PolicyDefinition> candidates = registry.getPoliciesFor(table, operation).stream()
                .filter(p -> p.decisionType().isAccessDecision())
                .toList();

        log.debug("Evaluating {} {} for user {} against {} allow/deny policies",
                operation.value(), table, StringSanitizer.forLog(evalCtx.auth().userId()), candidates.size());

        boolean defaultDeny = compiled.get().defaultDeny();

        // concatMap subscribes one predicate at a time; takeUntil stops at the first match
        return Flux.fromIterable(candidates)
                .concatMap(policy -> check(table, policy, evalCtx, activation))
                .takeUntil(PolicyTrace::matched)
                .collectList()
                .map(trace -> {
                    if (!trace.isEmpty() && trace.get(trace.size() - 1).matched()) {
                        PolicyTrace winner = trace.get(trace.size() - 1);
                        return EvaluationResult.matched(winner.decisionType(), winner.name(), trace);
                    }
                    return EvaluationResult.fallback(defaultDeny, EvaluationResult.REASON_DEFAULT, trace);
                })
                .map(result -> audited(table, operation, evalCtx, result));
    }

    private Mono<PolicyTrace> check(
            String table,
            PolicyDefinition policy,
            PolicyEvaluationContext ctx,
            PolicyActivationContext activation) {

        if (!isActive(table, policy, activation)) {
            return Mono.just(PolicyTrace.inactive(policy.name(), policy.decisionType()));
        }

        ConditionPolicy conditionPolicy = (ConditionPolicy) policy;
        return Mono.defer(() -> conditionPolicy.condition().evaluate(ctx))
                .defaultIfEmpty(Boolean.FALSE)
                .map(matched -> PolicyTrace.evaluated(policy.name(), policy.decisionType(), matched))
                .onErrorResume(error -> {
                    PredicateException failure = new PredicateException(table, policy.name(), error);
                    log.debug("{}", failure.getMessage());
                    return Mono.just(PolicyTrace.failed(policy.name(), policy.decisionType(), failure.getMessage()));
                });
    }

    // ----------------------------------------------------------------------
    // getFilters
    // ----------------------------------------------------------------------

    public Mono<FilterResult> getFilters(String table, Operation operation, PolicyEvaluationContext ctx) {
        return Mono.defer(() -> getFilters(table, operation, ctx, activationProvider.current()));
    }

    /**
     * Merges the output of every active filter policy.
     *
     * <p>Merge order is ascending priority, so on a key collision the filter
     * with the higher priority is applied last and its value wins. Among equal
     * priorities the policy declared first wins, matching the order in which
     * {@link #evaluate} would consider them. A filter function that throws
     * fails the whole call: silently dropping a filter would widen the result set.
     */
    public Mono<FilterResult> getFilters(
            String table,
            Operation operation,
            PolicyEvaluationContext ctx,
            PolicyActivationContext activation) {

        return Mono.fromCallable(() -> {
            PolicyEvaluationContext evalCtx = ctx.forTable(table, operation);
            if (isUnchecked(table, evalCtx)) {
                return FilterResult.empty();
            }
            Optional<CompiledTable> compiled = registry.getTable(table);
            if (compiled.isEmpty() || compiled.get().isSkippedFor(evalCtx.auth().roles())) {
                return FilterResult.empty();
            }

            List<PolicyDefinition> filters = new ArrayList<>(registry.getPoliciesFor(table, operation, DecisionType.FILTER));
            Collections.reverse(filters);

            Map<String, Object> conditions = new LinkedHashMap<>();
            List<String> applied = new ArrayList<>();
            for (PolicyDefinition policy : filters) {
                if (!isActive(table, policy, activation)) {
                    continue;
                }
                Map<String, Object> produced = applyFilter(table, (FilterPolicy) policy, evalCtx);
                produced.forEach((column, value) -> {
                    if (conditions.containsKey(column)) {
                        log.debug("Filter {} overrides condition {} on table {}", policy.name(), column, table);
                    }
                    conditions.put(column, value);
                });
                applied.add(policy.name());
            }

            FilterResult result = new FilterResult(conditions, applied);
            if (auditLogger != null && !applied.isEmpty()) {
                notifyAudit(() -> auditLogger.logFilter(table, applied, auditExtra(evalCtx, null)));
            }
            return result;
        });
    }

    private Map<String, Object> applyFilter(String table, FilterPolicy policy, PolicyEvaluationContext ctx) {
        Map<String, Object> produced;
        try {
            produced = policy.filter().apply(ctx);
        } catch (RuntimeException e) {
            throw new PolicyEvaluationException(table, policy.name(),
                    "filter '" + policy.name() + "' failed: " + e.getMessage(), e);
        }
        return produced != null ? produced : Map.of();
    }

    // ----------------------------------------------------------------------
    // validateWrite
    // ----------------------------------------------------------------------

    public Mono<Void> validateWrite(String table, Operation operation, PolicyEvaluationContext ctx) {
        return Mono.defer(() -> validateWrite(table, operation, ctx, activationProvider.current()));
    }

    /**
     * Runs every active validate policy in priority order. The first one that
     * returns {@code false} (or throws) fails the call with a
     * {@link ValidationException}; remaining validators are not run.
     */
    public Mono<Void> validateWrite(
            String table,
            Operation operation,
            PolicyEvaluationContext ctx,
            PolicyActivationContext activation) {

        if (!operation.isWrite()) {
            return Mono.empty();
        }
        PolicyEvaluationContext evalCtx = ctx.forTable(table, operation);
        if (isUnchecked(table, evalCtx)) {
            return Mono.empty();
        }
        Optional<CompiledTable> compiled = registry.getTable(table);
        if (compiled.isEmpty() || compiled.get().isSkippedFor(evalCtx.auth().roles())) {
            return Mono.empty();
        }

        List<PolicyDefinition> validators = registry.getPoliciesFor(table, operation, DecisionType.VALIDATE).stream()
                .filter(p -> isActive(table, p, activation))
                .toList();

        return Flux.fromIterable(validators)
                .concatMap(policy -> runValidator(table, (ConditionPolicy) policy, evalCtx)
                        .filter(passed -> !passed)
                        .map(failed -> policy))
                .next()
                .flatMap(failed -> Mono.<Void>error(new ValidationException(table, operation, failed.name())));
    }

    private Mono<Boolean> runValidator(String table, ConditionPolicy policy, PolicyEvaluationContext ctx) {
        return Mono.defer(() -> policy.condition().evaluate(ctx))
                .defaultIfEmpty(Boolean.FALSE)
                .onErrorResume(error -> {
                    log.debug("{}", new PredicateException(table, policy.name(), error).getMessage());
                    return Mono.just(Boolean.FALSE);
                });
    }

    // ----------------------------------------------------------------------
    // testPolicy / introspection
    // ----------------------------------------------------------------------

    /**
     * Invokes a single named policy directly, ignoring activation conditions
     * and bypass roles. Predicate failures read as {@code false}.
     */
    public Mono<PolicyTestResult> testPolicy(String table, String policyName, PolicyEvaluationContext ctx) {
        Optional<PolicyDefinition> found = registry.findPolicy(table, policyName);
        if (found.isEmpty()) {
            return Mono.just(PolicyTestResult.notFound());
        }
        PolicyDefinition policy = found.get();
        Operation operation = ctx.operation() != null ? ctx.operation() : firstOperation(policy);
        PolicyEvaluationContext evalCtx = ctx.forTable(table, operation);

        if (policy.decisionType() == DecisionType.FILTER) {
            return Mono.fromCallable(() -> PolicyTestResult.ofFilter(
                    applyFilter(table, (FilterPolicy) policy, evalCtx)));
        }
        return Mono.defer(() -> ((ConditionPolicy) policy).condition().evaluate(evalCtx))
                .defaultIfEmpty(Boolean.FALSE)
                .onErrorReturn(Boolean.FALSE)
                .map(PolicyTestResult::ofPredicate);
    }

    /**
     * Names of the policies for {@code table}/{@code operation} that are active right now.
     */
    public List<String> listActivePolicies(String table, Operation operation) {
        PolicyActivationContext activation = activationProvider.current();
        return registry.getPoliciesFor(table, operation).stream()
                .filter(p -> isActive(table, p, activation))
                .map(PolicyDefinition::name)
                .toList();
    }

    // ----------------------------------------------------------------------
    // helpers
    // ----------------------------------------------------------------------

    private boolean isUnchecked(String table, PolicyEvaluationContext ctx) {
        return settings.isExcluded(table) || ctx.auth().system() || settings.isBypassRole(ctx.auth().roles());
    }

    // A broken activation condition keeps restrictive policies in play and drops allow policies.
    private boolean isActive(String table, PolicyDefinition policy, PolicyActivationContext activation) {
        try {
            return policy.isActive(activation);
        } catch (RuntimeException e) {
            log.warn("Activation condition of policy {} on table {} failed: {}",
                    policy.name(), table, StringSanitizer.forLog(e.getMessage()));
            return policy.decisionType() != DecisionType.ALLOW;
        }
    }

    private static Operation firstOperation(PolicyDefinition policy) {
        return policy.operations().stream().sorted().findFirst().orElse(Operation.ALL);
    }

    private EvaluationResult audited(
            String table, Operation operation, PolicyEvaluationContext ctx, EvaluationResult result) {
        if (auditLogger == null) {
            return result;
        }
        Map<String, Object> extra = auditExtra(ctx, result.reason());
        if (result.allowed()) {
            notifyAudit(() -> auditLogger.logAllow(operation, table, result.policyName(), extra));
        } else {
            notifyAudit(() -> auditLogger.logDeny(operation, table, result.policyName(), extra));
        }
        return result;
    }

    private static Map<String, Object> auditExtra(PolicyEvaluationContext ctx, @Nullable String reason) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("user_id", ctx.auth().userId());
        extra.put("tenant_id", ctx.auth().tenantId());
        if (reason != null) {
            extra.put("reason", reason);
        }
        return extra;
    }

    // The audit sink must never change a decision.
    private static void notifyAudit(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("RLS audit logger failed: {}", StringSanitizer.forLog(e.getMessage()));
        }
    }
}
