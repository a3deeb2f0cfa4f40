package com.example.rls.exception;

import lombok.Getter;

// A required context resolver failed; evaluation must not proceed without its data.
@Getter
public class ContextResolutionException extends RlsException {

    private final String resolverName;

    public ContextResolutionException(String resolverName, Throwable cause) {
        super(String.format("Required context resolver '%s' failed: %s", resolverName, cause.getMessage()),
                RlsErrorCode.RLS_POLICY_EVALUATION_ERROR, cause);
        this.resolverName = resolverName;
    }
}
