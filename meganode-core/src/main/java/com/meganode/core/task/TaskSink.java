package com.meganode.core.task;

/**
 * Channel over which incidental tasks are handed to a sibling supervisor.
 */
@FunctionalInterface
public interface TaskSink {

    /**
     * Hand off a task without blocking.
     *
     * @return false if the task was dropped because the channel is full or closed
     */
    boolean trySend(NamedTask task);

    /**
     * Sink that runs nothing and reports every task as dropped.
     */
    static TaskSink discarding() {
        return task -> false;
    }
}
