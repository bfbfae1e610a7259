package com.meganode.core.model;

/**
 * Successful outcome of a run request, delivered through its ready waiter.
 *
 * Either the user node became ready and serves on {@code ports}, or it was run
 * with {@code shutdownAfterSync} and finished its sync before ever reporting
 * readiness, in which case {@code ports} is null and {@code syncCompleted} is true.
 */
public record UserRunResponse(
    UserPk userPk,
    RunPorts ports,
    boolean syncCompleted
) {
    public static UserRunResponse ready(RunPorts ports) {
        return new UserRunResponse(ports.userPk(), ports, false);
    }

    public static UserRunResponse syncCompleted(UserPk userPk) {
        return new UserRunResponse(userPk, null, true);
    }

    public boolean isReady() {
        return ports != null;
    }
}
