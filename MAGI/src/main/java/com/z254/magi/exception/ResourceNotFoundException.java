package com.z254.magi.exception;

/**
 * A session or artifact that does not exist, or is not visible to the caller.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException session(String sessionId) {
        return new ResourceNotFoundException("Session not found: " + sessionId);
    }

    public static ResourceNotFoundException artifact(String artifactId) {
        return new ResourceNotFoundException("Artifact not found: " + artifactId);
    }
}
