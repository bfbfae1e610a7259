package com.meganode.worker;

import com.meganode.core.model.UserPk;

import java.time.Duration;

/**
 * How a user node's task ended.
 */
public record UserNodeOutcome(
    UserPk userPk,
    long taskId,
    Status status,
    Throwable cause,
    Duration runtime
) {
    public enum Status {
        /** Returned normally, on its own or after a stop request. */
        COMPLETED,
        /** Threw, or its thread was interrupted without a stop request. */
        FAILED
    }

    public static UserNodeOutcome completed(UserPk userPk, long taskId, Duration runtime) {
        return new UserNodeOutcome(userPk, taskId, Status.COMPLETED, null, runtime);
    }

    public static UserNodeOutcome failed(UserPk userPk, long taskId, Throwable cause, Duration runtime) {
        return new UserNodeOutcome(userPk, taskId, Status.FAILED, cause, runtime);
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }

    /**
     * Short error label for logs and metric tags.
     */
    public String errorType() {
        if (cause == null) {
            return "none";
        }
        if (cause instanceof UserNodeException e) {
            return e.getErrorCode();
        }
        return cause.getClass().getSimpleName();
    }
}
