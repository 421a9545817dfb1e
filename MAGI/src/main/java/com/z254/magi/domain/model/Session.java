package com.z254.magi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A deliberation over one question.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private String id;

    private String userId;

    private String question;

    /**
     * Uploaded code bundle feeding the repository context, if any.
     */
    private String artifactId;

    /**
     * Normalized live site URL feeding the live site context, if any.
     */
    private String liveUrl;

    private SessionStatus status;

    /**
     * Last failure reason when status is error.
     */
    private String error;

    private Instant createdAt;

    private Instant updatedAt;
}
