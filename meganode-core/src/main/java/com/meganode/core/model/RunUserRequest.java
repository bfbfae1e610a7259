package com.meganode.core.model;

import java.util.concurrent.CompletableFuture;

/**
 * Request to admit a user, or to keep an already admitted user alive.
 * Repeated run requests double as lease renewals.
 *
 * The ready waiter is completed exactly once: with a {@link UserRunResponse}
 * when the user node is ready, or exceptionally with a
 * {@link com.meganode.core.exception.MeganodeException} describing the rejection.
 */
public record RunUserRequest(
    UserPk userPk,
    LeaseId leaseId,
    MegaId megaId,
    boolean shutdownAfterSync,
    CompletableFuture<UserRunResponse> readyWaiter
) implements RunnerCommand {

    public static RunUserRequest of(UserPk userPk, LeaseId leaseId, MegaId megaId, boolean shutdownAfterSync) {
        return new RunUserRequest(userPk, leaseId, megaId, shutdownAfterSync, new CompletableFuture<>());
    }
}
