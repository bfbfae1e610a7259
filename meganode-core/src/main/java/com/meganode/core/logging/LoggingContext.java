package com.meganode.core.logging;

import com.meganode.core.model.LeaseId;
import com.meganode.core.model.MegaId;
import com.meganode.core.model.UserPk;
import org.slf4j.MDC;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures log lines emitted while handling a user carry the user's identity.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forUser(userPk, leaseId)) {
 *     log.info("Admitting user"); // Automatically includes userPk, leaseId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String MEGA_ID = "megaId";
    public static final String USER_PK = "userPk";
    public static final String LEASE_ID = "leaseId";

    private LoggingContext() {
    }

    /**
     * Tag every log line of the current thread with this meganode's id.
     * Not removed by {@link #close()}.
     */
    public static void setMegaId(MegaId megaId) {
        if (megaId != null) {
            MDC.put(MEGA_ID, megaId.toString());
        }
    }

    public static LoggingContext forUser(UserPk userPk) {
        return forUser(userPk, null);
    }

    public static LoggingContext forUser(UserPk userPk, LeaseId leaseId) {
        LoggingContext ctx = new LoggingContext();
        if (userPk != null) {
            MDC.put(USER_PK, userPk.shortId());
        }
        if (leaseId != null) {
            MDC.put(LEASE_ID, leaseId.toString());
        }
        return ctx;
    }

    public static String getUserPk() {
        return MDC.get(USER_PK);
    }

    @Override
    public void close() {
        MDC.remove(USER_PK);
        MDC.remove(LEASE_ID);
    }

    /**
     * Clear all MDC context. Call when a long-lived thread exits.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
