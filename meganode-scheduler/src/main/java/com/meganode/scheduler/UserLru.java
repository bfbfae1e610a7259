package com.meganode.scheduler;

import com.meganode.core.model.UserPk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Users ordered by most recent activity, least recent first.
 * Used to pick eviction victims.
 *
 * Order follows the sequence of {@link #touch} calls, not the supplied
 * timestamps, so users touched at the same instant keep insertion order.
 */
final class UserLru {

    private final LinkedHashMap<UserPk, Instant> users = new LinkedHashMap<>();

    /**
     * Mark a user as most recently used, inserting it if absent.
     */
    void touch(UserPk userPk, Instant now) {
        users.remove(userPk);
        users.put(userPk, now);
    }

    /**
     * @return true if the user was present
     */
    boolean remove(UserPk userPk) {
        return users.remove(userPk) != null;
    }

    /**
     * Up to {@code n} users, least recently used first.
     */
    List<UserPk> leastRecent(int n) {
        List<UserPk> result = new ArrayList<>(Math.min(n, users.size()));
        Iterator<UserPk> it = users.keySet().iterator();
        while (it.hasNext() && result.size() < n) {
            result.add(it.next());
        }
        return result;
    }

    Instant lastTouched(UserPk userPk) {
        return users.get(userPk);
    }

    boolean contains(UserPk userPk) {
        return users.containsKey(userPk);
    }

    boolean isEmpty() {
        return users.isEmpty();
    }

    int size() {
        return users.size();
    }

    /**
     * Read-only view, least recently used first.
     */
    Set<UserPk> users() {
        return Collections.unmodifiableSet(users.keySet());
    }
}
