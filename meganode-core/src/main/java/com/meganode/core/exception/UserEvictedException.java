package com.meganode.core.exception;

import com.meganode.core.model.UserPk;

/**
 * Completes ready waiters of a user that was evicted before it became ready.
 */
public class UserEvictedException extends MeganodeException {

    public static final String ERROR_CODE = "USER_EVICTED";

    public UserEvictedException(UserPk userPk) {
        super(ERROR_CODE, String.format("User %s was evicted before becoming ready", userPk.shortId()));
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
