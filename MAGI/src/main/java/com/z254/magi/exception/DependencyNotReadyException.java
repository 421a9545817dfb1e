package com.z254.magi.exception;

/**
 * A referenced resource exists but cannot be used yet, e.g. an artifact still processing.
 */
public class DependencyNotReadyException extends RuntimeException {

    public DependencyNotReadyException(String message) {
        super(message);
    }
}
