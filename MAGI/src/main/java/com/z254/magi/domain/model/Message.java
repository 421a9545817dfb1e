package com.z254.magi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Append-only transcript entry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    /**
     * Repository-assigned id, strictly increasing within a session.
     */
    private Long id;

    private String sessionId;

    /**
     * Authoring agent. Null for user and consensus messages.
     */
    private String agentId;

    private MessageRole role;

    private String content;

    private String model;

    /**
     * Structured provenance: provider, stage, fallback, actualProvider, httpRequestCount
     * for proposals; fromMessageId, totalScore for consensus.
     */
    @Builder.Default
    private Map<String, Object> meta = new HashMap<>();

    private Instant createdAt;

    public boolean hasRole(MessageRole expected) {
        return role == expected;
    }

    /**
     * Read a boolean flag from meta, treating absent or non-boolean values as false.
     */
    public boolean metaFlag(String key) {
        return meta != null && Boolean.TRUE.equals(meta.get(key));
    }

    /**
     * Read a numeric id from meta.
     */
    public Long metaLong(String key) {
        if (meta == null) {
            return null;
        }
        Object value = meta.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
