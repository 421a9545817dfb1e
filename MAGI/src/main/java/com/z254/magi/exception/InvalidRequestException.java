package com.z254.magi.exception;

/**
 * Malformed or incomplete input from a caller.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
