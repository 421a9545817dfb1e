package com.z254.magi.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Roles of messages in a session transcript.
 */
public enum MessageRole {

    /**
     * The question asked by the user.
     */
    USER("user"),

    /**
     * An agent's first-pass answer.
     */
    AGENT_PROPOSAL("agent_proposal"),

    /**
     * An agent's critique of another proposal. No step produces it at present;
     * kept so stored transcripts and diagnostics keep their shape.
     */
    AGENT_CRITIQUE("agent_critique"),

    /**
     * The winning proposal echoed as the session's answer.
     */
    CONSENSUS("consensus");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
