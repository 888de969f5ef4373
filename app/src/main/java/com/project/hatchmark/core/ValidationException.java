package com.project.hatchmark.core;

/**
 * Malformed hash, title or other request field.
 */
public class ValidationException extends HatchmarkException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
