package com.meganode.core.exception;

/**
 * Base exception for all meganode errors.
 */
public class MeganodeException extends RuntimeException {

    private final String errorCode;

    public MeganodeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MeganodeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the fleet manager may retry the same request later.
     */
    public boolean isRetryable() {
        return false;
    }
}
