package com.example.rls.exception;

import lombok.Getter;
import org.springframework.lang.Nullable;

// Non-recoverable evaluation failure. Always fails closed.
@Getter
public class PolicyEvaluationException extends RlsException {

    private final String table;
    @Nullable
    private final String policyName;

    public PolicyEvaluationException(String table, @Nullable String policyName, String message, Throwable cause) {
        super(String.format("RLS policy evaluation error on %s: %s", table, message),
                RlsErrorCode.RLS_POLICY_EVALUATION_ERROR, cause);
        this.table = table;
        this.policyName = policyName;
    }
}
