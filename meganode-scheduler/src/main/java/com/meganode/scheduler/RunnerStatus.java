package com.meganode.scheduler;

import com.meganode.core.model.LeaseId;
import com.meganode.core.model.MegaId;
import com.meganode.core.model.UserPk;
import com.meganode.core.model.UserState;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the user runner, safe to read from any thread.
 */
public record RunnerStatus(
    MegaId megaId,
    int starting,
    int running,
    int evicting,
    long currentMemory,
    long softLimit,
    long hardLimit,
    Instant lastMegaActivity,
    boolean shutdownRequested,
    List<UserStatus> users
) {
    public int totalUsers() {
        return starting + running + evicting;
    }

    public record UserStatus(
        UserPk userPk,
        UserState state,
        LeaseId leaseId,
        Instant lastActiveAt,
        Instant leaseExpiresAt
    ) {
        public boolean isLeaseExpired(Instant now) {
            return leaseExpiresAt.isBefore(now);
        }
    }
}
