package com.project.hatchmark.core;

/**
 * Unknown certificate or dispute id.
 */
public class NotFoundException extends HatchmarkException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
