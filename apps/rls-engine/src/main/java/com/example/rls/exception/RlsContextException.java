package com.example.rls.exception;

public class RlsContextException extends RlsException {

    public RlsContextException() {
        super("No RLS context found in reactive context. Use RlsContextHolder.withContext(...)",
                RlsErrorCode.RLS_CONTEXT_MISSING);
    }
}
