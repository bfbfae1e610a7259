package com.meganode.scheduler;

import com.meganode.core.exception.InvalidStateTransitionException;
import com.meganode.core.model.LeaseId;
import com.meganode.core.model.RunPorts;
import com.meganode.core.model.UserPk;
import com.meganode.core.model.UserRunResponse;
import com.meganode.core.model.UserState;
import com.meganode.worker.UserNodeHandle;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The user runner's record of one starting, running or evicting user node.
 * Created on admission, removed once the node's task completion is observed.
 *
 * Waiters live here rather than pointing back at the entry; each waiter is
 * removed from its queue when it is completed, so none completes twice.
 */
final class UserEntry {

    private final UserPk userPk;
    private final UserNodeHandle handle;
    private final boolean shutdownAfterSync;
    private final Instant admittedAt;

    private UserState state = UserState.STARTING;
    private LeaseId leaseId;
    private Instant leaseExpiresAt;
    private Instant lastActiveAt;
    private RunPorts ports;

    private final Deque<CompletableFuture<UserRunResponse>> readyWaiters = new ArrayDeque<>();
    private final Deque<CompletableFuture<Void>> stoppedWaiters = new ArrayDeque<>();

    UserEntry(
            UserPk userPk,
            LeaseId leaseId,
            boolean shutdownAfterSync,
            UserNodeHandle handle,
            Instant now,
            Instant leaseExpiresAt) {
        this.userPk = userPk;
        this.leaseId = leaseId;
        this.shutdownAfterSync = shutdownAfterSync;
        this.handle = handle;
        this.admittedAt = now;
        this.lastActiveAt = now;
        this.leaseExpiresAt = leaseExpiresAt;
    }

    void transitionTo(UserState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(userPk, state, target);
        }
        state = target;
    }

    void renewLease(LeaseId leaseId, Instant leaseExpiresAt) {
        this.leaseId = leaseId;
        this.leaseExpiresAt = leaseExpiresAt;
    }

    void markActive(Instant now) {
        // Keep lastActiveAt monotonic even if callers pass stale timestamps
        if (now.isAfter(lastActiveAt)) {
            lastActiveAt = now;
        }
    }

    void setPorts(RunPorts ports) {
        this.ports = ports;
    }

    void addReadyWaiter(CompletableFuture<UserRunResponse> waiter) {
        readyWaiters.add(waiter);
    }

    void addStoppedWaiter(CompletableFuture<Void> waiter) {
        stoppedWaiters.add(waiter);
    }

    /**
     * Remove and return all pending ready waiters.
     */
    List<CompletableFuture<UserRunResponse>> takeReadyWaiters() {
        List<CompletableFuture<UserRunResponse>> taken = new ArrayList<>(readyWaiters);
        readyWaiters.clear();
        return taken;
    }

    /**
     * Remove and return all pending stopped waiters.
     */
    List<CompletableFuture<Void>> takeStoppedWaiters() {
        List<CompletableFuture<Void>> taken = new ArrayList<>(stoppedWaiters);
        stoppedWaiters.clear();
        return taken;
    }

    UserPk userPk() {
        return userPk;
    }

    UserNodeHandle handle() {
        return handle;
    }

    boolean shutdownAfterSync() {
        return shutdownAfterSync;
    }

    Instant admittedAt() {
        return admittedAt;
    }

    UserState state() {
        return state;
    }

    LeaseId leaseId() {
        return leaseId;
    }

    Instant leaseExpiresAt() {
        return leaseExpiresAt;
    }

    Instant lastActiveAt() {
        return lastActiveAt;
    }

    RunPorts ports() {
        return ports;
    }

    int readyWaiterCount() {
        return readyWaiters.size();
    }

    int stoppedWaiterCount() {
        return stoppedWaiters.size();
    }
}
