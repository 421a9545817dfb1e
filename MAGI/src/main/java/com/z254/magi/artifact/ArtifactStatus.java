package com.z254.magi.artifact;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing state of an uploaded code bundle.
 */
public enum ArtifactStatus {
    UPLOADED,
    PROCESSING,
    READY,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
