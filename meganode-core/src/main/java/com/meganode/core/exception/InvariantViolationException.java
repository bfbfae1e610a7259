package com.meganode.core.exception;

/**
 * Thrown when the runner's bookkeeping no longer matches reality.
 * This is a programming error; further scheduling decisions would be unsafe.
 */
public class InvariantViolationException extends MeganodeException {

    public static final String ERROR_CODE = "INVARIANT_VIOLATION";

    public InvariantViolationException(String message) {
        super(ERROR_CODE, message);
    }
}
