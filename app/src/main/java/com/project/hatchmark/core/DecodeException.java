package com.project.hatchmark.core;

/**
 * Image bytes could not be decoded into pixels.
 */
public class DecodeException extends HatchmarkException {

    public DecodeException(String message) {
        super(ErrorCode.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorCode.DECODE, message, cause);
    }
}
