package com.z254.magi.tool.builtin;

/**
 * The relay refused a request before sending it.
 */
public class RelayRejectedException extends RuntimeException {

    public RelayRejectedException(String message) {
        super(message);
    }
}
