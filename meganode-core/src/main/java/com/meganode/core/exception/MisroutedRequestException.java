package com.meganode.core.exception;

import com.meganode.core.model.MegaId;

/**
 * Thrown when a request addressed to another meganode reaches this one.
 */
public class MisroutedRequestException extends MeganodeException {

    public static final String ERROR_CODE = "MISROUTED_REQUEST";

    public MisroutedRequestException(MegaId requested, MegaId actual) {
        super(ERROR_CODE, String.format(
            "Request was for meganode %s but this is meganode %s",
            requested, actual
        ));
    }
}
