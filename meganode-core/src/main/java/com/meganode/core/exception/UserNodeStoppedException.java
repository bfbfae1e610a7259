package com.meganode.core.exception;

import com.meganode.core.model.UserPk;

/**
 * Completes ready waiters of a user node that finished without becoming ready.
 */
public class UserNodeStoppedException extends MeganodeException {

    public static final String ERROR_CODE = "USER_NODE_STOPPED";

    public UserNodeStoppedException(UserPk userPk, String reason) {
        super(ERROR_CODE, String.format("User node %s stopped before becoming ready: %s",
            userPk.shortId(), reason));
    }

    public UserNodeStoppedException(UserPk userPk, Throwable cause) {
        super(ERROR_CODE, String.format("User node %s failed before becoming ready: %s",
            userPk.shortId(), cause.getMessage()), cause);
    }
}
