package com.meganode.core.model;

/**
 * Lifecycle states of a user node tracked by the user runner.
 * A user with no entry is not represented here; removal is the terminal step.
 *
 * <pre>
 * (none) -> STARTING -> RUNNING -> EVICTING -> (none)
 *           STARTING ------------> EVICTING
 * </pre>
 */
public enum UserState {
    /**
     * Admitted and spawned, not yet reported ready.
     * Transitions: -> RUNNING, EVICTING
     */
    STARTING,

    /**
     * Ready and serving.
     * Transitions: -> EVICTING
     */
    RUNNING,

    /**
     * Told to stop; still holds its memory slot until its task completes.
     * Transitions: -> (removed)
     */
    EVICTING;

    /**
     * Whether the user is eligible for the recency index.
     */
    public boolean isLive() {
        return this == STARTING || this == RUNNING;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(UserState target) {
        return switch (this) {
            case STARTING -> target == RUNNING || target == EVICTING;
            case RUNNING -> target == EVICTING;
            case EVICTING -> false;
        };
    }
}
