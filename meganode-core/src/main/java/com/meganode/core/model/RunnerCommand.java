package com.meganode.core.model;

/**
 * A command consumed by the user runner's control loop.
 * Commands are processed strictly in arrival order.
 */
public interface RunnerCommand {

    /**
     * The user this command targets.
     */
    UserPk userPk();
}
