package com.project.hatchmark.core;

/**
 * The off-chain projection did not catch up with a submitted transaction in time.
 */
public class SyncTimeoutException extends HatchmarkException {

    public SyncTimeoutException(String message) {
        super(ErrorCode.SYNC_TIMEOUT, message);
    }

    public SyncTimeoutException(String message, Throwable cause) {
        super(ErrorCode.SYNC_TIMEOUT, message, cause);
    }
}
