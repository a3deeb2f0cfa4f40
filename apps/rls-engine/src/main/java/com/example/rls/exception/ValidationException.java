package com.example.rls.exception;

import com.example.rls.context.Operation;
import lombok.Getter;

/**
 * A {@code validate} policy rejected the proposed write payload.
 */
@Getter
public class ValidationException extends RlsException {

    private final String table;
    private final Operation operation;
    private final String policyName;

    public ValidationException(String table, Operation operation, String policyName) {
        super(String.format("Validation failed for %s on %s: policy '%s' rejected the payload",
                        operation.value(), table, policyName),
                RlsErrorCode.RLS_VALIDATION_FAILED);
        this.table = table;
        this.operation = operation;
        this.policyName = policyName;
    }
}
