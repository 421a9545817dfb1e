package com.z254.magi.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Externally triggered workflow steps, in their intended order.
 */
public enum WorkflowStep {
    PROPOSE("propose"),
    VOTE("vote"),
    CONSENSUS("consensus");

    private final String value;

    WorkflowStep(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The step a client is expected to trigger next, or null after consensus.
     */
    public WorkflowStep next() {
        return switch (this) {
            case PROPOSE -> VOTE;
            case VOTE -> CONSENSUS;
            case CONSENSUS -> null;
        };
    }

    public static Optional<WorkflowStep> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(step -> step.value.equals(value.trim()))
                .findFirst();
    }
}
