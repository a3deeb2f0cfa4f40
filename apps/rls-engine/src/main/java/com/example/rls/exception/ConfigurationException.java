package com.example.rls.exception;

// Programming or schema mistake. Raised at registration time and never caught internally.
public class ConfigurationException extends RlsException {

    public ConfigurationException(String message) {
        super(message, RlsErrorCode.RLS_SCHEMA_INVALID);
    }

    public ConfigurationException(String message, RlsErrorCode code) {
        super(message, code);
    }
}
