package com.meganode.scheduler;

import com.meganode.core.model.UserPk;

import java.util.Set;

/**
 * Upstream recipient of user activity, so the fleet manager knows which users
 * are busy. Called from a helper task, never from the runner's loop.
 */
@FunctionalInterface
public interface ActivityReporter {

    void reportActivity(Set<UserPk> activeUsers) throws Exception;
}
