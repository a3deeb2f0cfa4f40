package com.example.rls.exception;

import lombok.Getter;

@Getter
public class RlsException extends RuntimeException {

    private final RlsErrorCode code;

    public RlsException(String message, RlsErrorCode code) {
        super(message);
        this.code = code;
    }

    public RlsException(String message, RlsErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "code=" + code +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
