package com.meganode.core.task;

/**
 * A short-lived unit of work with a name for logs and hung-task reports.
 */
public record NamedTask(String name, Runnable body) {

    public NamedTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("Task body must not be null");
        }
    }
}
