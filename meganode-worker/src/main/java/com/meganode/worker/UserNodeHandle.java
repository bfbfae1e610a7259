package com.meganode.worker;

import com.meganode.core.model.UserPk;

import java.time.Duration;
import java.util.Optional;

/**
 * Opaque handle to a spawned user node task.
 */
public interface UserNodeHandle {

    UserPk userPk();

    /**
     * Identifies this spawn; a user spawned again later gets a new id.
     */
    long taskId();

    /**
     * Ask the node to stop. Cooperative and idempotent; never interrupts the node.
     */
    void stop();

    boolean isStopRequested();

    boolean isFinished();

    /**
     * Wait up to {@code timeout} for the node's task to end.
     */
    Optional<UserNodeOutcome> join(Duration timeout) throws InterruptedException;
}
