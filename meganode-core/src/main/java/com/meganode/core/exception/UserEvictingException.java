package com.meganode.core.exception;

import com.meganode.core.model.UserPk;

/**
 * Thrown when a run request arrives for a user whose node is shutting down.
 * The caller should wait for the stop to complete and try again.
 */
public class UserEvictingException extends MeganodeException {

    public static final String ERROR_CODE = "USER_EVICTING";

    public UserEvictingException(UserPk userPk) {
        super(ERROR_CODE, String.format("User %s is being evicted", userPk.shortId()));
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
