package com.example.rls.exception;

import com.example.rls.context.Operation;
import com.example.rls.engine.EvaluationResult;
import lombok.Getter;
import org.springframework.lang.Nullable;

/**
 * Row- or field-level denial. Permanent: callers must not retry.
 */
@Getter
public class AccessDeniedException extends RlsException {

    private final String table;
    private final Operation operation;
    @Nullable
    private final String policyName;
    private final String reason;
    @Nullable
    private final String field;
    @Nullable
    private final EvaluationResult decision;

    public AccessDeniedException(String table, Operation operation, @Nullable String policyName,
            String reason, @Nullable EvaluationResult decision) {
        super(String.format("RLS policy violation: %s on %s - %s", operation.value(), table, reason),
                RlsErrorCode.RLS_POLICY_VIOLATION);
        this.table = table;
        this.operation = operation;
        this.policyName = policyName;
        this.reason = reason;
        this.field = null;
        this.decision = decision;
    }

    private AccessDeniedException(String table, Operation operation, String field, String reason) {
        super(String.format("RLS policy violation: %s on %s - %s", operation.value(), table, reason),
                RlsErrorCode.RLS_POLICY_VIOLATION);
        this.table = table;
        this.operation = operation;
        this.policyName = null;
        this.reason = reason;
        this.field = field;
        this.decision = null;
    }

    public static AccessDeniedException forDecision(String table, Operation operation, EvaluationResult decision) {
        return new AccessDeniedException(table, operation, decision.policyName(),
                decision.reason() != null ? decision.reason() : "denied", decision);
    }

    public static AccessDeniedException forField(String table, Operation operation, String field) {
        String verb = operation == Operation.READ ? "read" : "write";
        return new AccessDeniedException(table, operation, field,
                String.format("Cannot %s protected field: %s", verb, field));
    }
}
