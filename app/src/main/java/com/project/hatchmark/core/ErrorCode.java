package com.project.hatchmark.core;

/**
 * Error taxonomy shared by the API layer, the workflow orchestrator and the HTTP adapter.
 */
public enum ErrorCode {
    VALIDATION(400),
    DUPLICATE(409),
    NOT_FOUND(404),
    UNAUTHORIZED(403),
    ALREADY_RESOLVED(409),
    INSUFFICIENT_STAKE(402),
    LEDGER(502),
    SYNC_TIMEOUT(504),
    DECODE(422);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
