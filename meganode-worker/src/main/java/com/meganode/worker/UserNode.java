package com.meganode.worker;

/**
 * A user's Lightning node, run by the meganode on behalf of one user.
 * The user runner never inspects what a node does; it only starts it,
 * waits for readiness, and asks it to stop.
 *
 * Contract:
 * - call {@link UserNodeContext#markReady} at most once, or simply return
 * - return in bounded time once {@link UserNodeContext#isStopRequested()} is true
 * - never touch runner state directly
 */
@FunctionalInterface
public interface UserNode {

    /**
     * Run the node until it finishes or is asked to stop.
     *
     * @param context Per-user context providing identity, readiness and stop signals
     * @throws UserNodeException if the node fails
     * @throws InterruptedException if the node's thread is interrupted while blocked
     */
    void run(UserNodeContext context) throws UserNodeException, InterruptedException;
}
