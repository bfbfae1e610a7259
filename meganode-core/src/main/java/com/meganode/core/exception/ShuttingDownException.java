package com.meganode.core.exception;

/**
 * Completes waiters that were still pending when the meganode shut down.
 */
public class ShuttingDownException extends MeganodeException {

    public static final String ERROR_CODE = "MEGA_SHUTTING_DOWN";

    public ShuttingDownException() {
        super(ERROR_CODE, "Meganode is shutting down");
    }
}
