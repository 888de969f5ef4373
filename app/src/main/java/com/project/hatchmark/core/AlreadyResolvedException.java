package com.project.hatchmark.core;

public class AlreadyResolvedException extends HatchmarkException {

    public AlreadyResolvedException(String message) {
        super(ErrorCode.ALREADY_RESOLVED, message);
    }

    public AlreadyResolvedException(String message, Throwable cause) {
        super(ErrorCode.ALREADY_RESOLVED, message, cause);
    }
}
