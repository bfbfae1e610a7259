package com.meganode.core.exception;

import com.meganode.core.model.UserPk;
import com.meganode.core.model.UserState;

/**
 * Thrown when an invalid user state transition is attempted.
 */
public class InvalidStateTransitionException extends InvariantViolationException {

    public InvalidStateTransitionException(UserPk userPk, UserState currentState, UserState targetState) {
        super(String.format(
            "Cannot transition user %s from %s to %s",
            userPk.shortId(), currentState, targetState
        ));
    }
}
