package com.z254.magi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * LLM providers backing the three agents.
 * Each provider selects the credential, the endpoint family and the wire protocol.
 */
public enum ProviderType {

    /**
     * OpenAI chat completions.
     */
    OPENAI("openai", ProtocolFamily.OPENAI_COMPATIBLE),

    /**
     * Anthropic messages API.
     */
    ANTHROPIC("anthropic", ProtocolFamily.ANTHROPIC_MESSAGES),

    /**
     * xAI Grok, wire-compatible with OpenAI chat completions.
     */
    GROK("grok", ProtocolFamily.OPENAI_COMPATIBLE);

    private final String id;
    private final ProtocolFamily family;

    ProviderType(String id, ProtocolFamily family) {
        this.id = id;
        this.family = family;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public ProtocolFamily getFamily() {
        return family;
    }

    public static Optional<ProviderType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase();
        if (normalized.equals("xai")) {
            return Optional.of(GROK);
        }
        return Arrays.stream(values())
                .filter(p -> p.id.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    static ProviderType fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + id));
    }

    /**
     * Wire protocol families.
     */
    public enum ProtocolFamily {
        OPENAI_COMPATIBLE,
        ANTHROPIC_MESSAGES
    }
}
