package com.example.rls.exception;

import lombok.Getter;

/**
 * A policy predicate threw while being evaluated.
 *
 * <p>Contained within one evaluation step: the evaluator records it in the
 * trace as a non-match and moves on to the next policy.
 */
@Getter
public class PredicateException extends RlsException {

    private final String table;
    private final String policyName;

    public PredicateException(String table, String policyName, Throwable cause) {
        super(String.format("Predicate of policy '%s' on table '%s' failed: %s",
                        policyName, table, cause.getMessage()),
                RlsErrorCode.RLS_POLICY_EVALUATION_ERROR, cause);
        this.table = table;
        this.policyName = policyName;
    }
}
