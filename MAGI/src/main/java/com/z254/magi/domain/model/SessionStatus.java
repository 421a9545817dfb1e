package com.z254.magi.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Advisory session state set by the workflow engine.
 */
public enum SessionStatus {
    PENDING,
    RUNNING,
    CONSENSUS,
    COMPLETE,
    ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
