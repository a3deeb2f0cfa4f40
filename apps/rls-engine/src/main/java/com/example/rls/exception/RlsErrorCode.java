package com.example.rls.exception;

/**
 * Stable error codes carried by every {@link RlsException}.
 */
public enum RlsErrorCode {
    RLS_CONTEXT_MISSING,
    RLS_POLICY_VIOLATION,
    RLS_POLICY_INVALID,
    RLS_SCHEMA_INVALID,
    RLS_VALIDATION_FAILED,
    RLS_POLICY_EVALUATION_ERROR
}
