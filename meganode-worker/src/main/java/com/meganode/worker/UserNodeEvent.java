package com.meganode.worker;

import com.meganode.core.model.RunPorts;
import com.meganode.core.model.UserPk;

/**
 * Event reported by a user node task to the user runner through the supervisor.
 * Events of one task are delivered in the order the task produced them, and
 * {@link Finished} is always the last event of a task.
 */
public interface UserNodeEvent {

    UserPk userPk();

    long taskId();

    /**
     * The node reported it is ready to serve.
     */
    record Ready(UserPk userPk, long taskId, RunPorts ports) implements UserNodeEvent {
    }

    /**
     * The node's task ended.
     */
    record Finished(UserNodeOutcome outcome) implements UserNodeEvent {

        @Override
        public UserPk userPk() {
            return outcome.userPk();
        }

        @Override
        public long taskId() {
            return outcome.taskId();
        }
    }

    /**
     * The node observed activity from its user.
     */
    record Active(UserPk userPk, long taskId) implements UserNodeEvent {
    }
}
