package com.meganode.core.model;

import java.util.concurrent.CompletableFuture;

/**
 * Request to stop a user node. The stopped waiter completes once the user's
 * memory slot is free, or at once if the user was not running here.
 */
public record EvictUserRequest(
    UserPk userPk,
    MegaId megaId,
    CompletableFuture<Void> stoppedWaiter
) implements RunnerCommand {

    public static EvictUserRequest of(UserPk userPk, MegaId megaId) {
        return new EvictUserRequest(userPk, megaId, new CompletableFuture<>());
    }
}
