package com.project.hatchmark.store;

/**
 * The off-chain store could not complete a read or write.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
