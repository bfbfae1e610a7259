package com.meganode.worker;

/**
 * Exception thrown by user nodes on failure.
 */
public class UserNodeException extends Exception {

    private final String errorCode;

    public UserNodeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public UserNodeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
