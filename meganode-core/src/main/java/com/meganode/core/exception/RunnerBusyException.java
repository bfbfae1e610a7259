package com.meganode.core.exception;

/**
 * Thrown when the user runner's command queue is full.
 */
public class RunnerBusyException extends MeganodeException {

    public static final String ERROR_CODE = "RUNNER_BUSY";

    public RunnerBusyException(int capacity) {
        super(ERROR_CODE, String.format("User runner command queue is full (capacity %d)", capacity));
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
