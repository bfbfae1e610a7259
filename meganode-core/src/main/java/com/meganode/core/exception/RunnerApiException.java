package com.meganode.core.exception;

/**
 * Thrown when the upstream runner rejects or fails a callback.
 */
public class RunnerApiException extends MeganodeException {

    public static final String ERROR_CODE = "RUNNER_API_ERROR";

    private final int statusCode;

    public RunnerApiException(String endpoint, int statusCode, String body) {
        super(ERROR_CODE, String.format("Runner call %s failed with status %d: %s", endpoint, statusCode, body));
        this.statusCode = statusCode;
    }

    public RunnerApiException(String endpoint, Throwable cause) {
        super(ERROR_CODE, String.format("Runner call %s failed: %s", endpoint, cause.getMessage()), cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed call, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return statusCode < 0 || statusCode >= 500;
    }
}
