package com.project.hatchmark.core;

/**
 * Raised when someone other than the certificate creator tries to resolve a dispute.
 */
public class UnauthorizedException extends HatchmarkException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(ErrorCode.UNAUTHORIZED, message, cause);
    }
}
