package com.z254.magi.exception;

/**
 * Session repository failure. Fatal to the running workflow step.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
