package com.meganode.core.exception;

import com.meganode.core.model.UserPk;

/**
 * Thrown when admitting another user would exceed the hard memory limit.
 */
public class AdmissionDeniedException extends MeganodeException {

    public static final String ERROR_CODE = "ADMISSION_DENIED";

    private final boolean evictionInProgress;

    public AdmissionDeniedException(UserPk userPk, long currentMemory, long hardLimit, boolean evictionInProgress) {
        super(ERROR_CODE, String.format(
            "Cannot admit user %s: %d of %d bytes in use%s",
            userPk.shortId(), currentMemory, hardLimit,
            evictionInProgress ? " (evicting idle users, retry later)" : ""
        ));
        this.evictionInProgress = evictionInProgress;
    }

    /**
     * Whether enough users are already being evicted to make room for this one.
     */
    public boolean isEvictionInProgress() {
        return evictionInProgress;
    }

    @Override
    public boolean isRetryable() {
        return evictionInProgress;
    }
}
