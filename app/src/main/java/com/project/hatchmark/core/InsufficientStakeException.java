package com.project.hatchmark.core;

public class InsufficientStakeException extends HatchmarkException {

    public InsufficientStakeException(String message) {
        super(ErrorCode.INSUFFICIENT_STAKE, message);
    }

    public InsufficientStakeException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_STAKE, message, cause);
    }
}
