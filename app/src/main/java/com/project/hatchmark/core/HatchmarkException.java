package com.project.hatchmark.core;

/**
 * Base class for every failure the system reports to a caller.
 */
public class HatchmarkException extends RuntimeException {

    private final ErrorCode code;

    public HatchmarkException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public HatchmarkException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
