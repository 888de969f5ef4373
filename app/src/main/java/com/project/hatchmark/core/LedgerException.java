package com.project.hatchmark.core;

/**
 * Failure reported by, or while talking to, the ledger.
 *
 * <p>{@code retryable} is true only for transport-level failures (connection refused, timeout,
 * HTTP 5xx). A transaction the ledger itself rejected is never retryable and carries the ledger's
 * own reason as its message.
 */
public class LedgerException extends HatchmarkException {

    private final boolean retryable;

    public LedgerException(String message, boolean retryable) {
        super(ErrorCode.LEDGER, message);
        this.retryable = retryable;
    }

    public LedgerException(String message, boolean retryable, Throwable cause) {
        super(ErrorCode.LEDGER, message, cause);
        this.retryable = retryable;
    }

    public static LedgerException rejected(String reason) {
        return new LedgerException(reason, false);
    }

    public static LedgerException transport(String message, Throwable cause) {
        return new LedgerException(message, true, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
