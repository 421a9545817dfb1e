package com.z254.magi.api.dto;

import com.z254.magi.domain.model.Consensus;
import com.z254.magi.domain.model.Session;
import com.z254.magi.domain.model.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Session list entry with its consensus pointer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummary {

    private String id;
    private String question;
    private SessionStatus status;
    private String error;
    private String artifactId;
    private String liveUrl;
    private Instant createdAt;
    private Instant updatedAt;
    private Long finalMessageId;
    private String consensusSummary;

    public static SessionSummary of(Session session, Consensus consensus) {
        return SessionSummary.builder()
                .id(session.getId())
                .question(session.getQuestion())
                .status(session.getStatus())
                .error(session.getError())
                .artifactId(session.getArtifactId())
                .liveUrl(session.getLiveUrl())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .finalMessageId(consensus != null ? consensus.getFinalMessageId() : null)
                .consensusSummary(consensus != null ? consensus.getSummary() : null)
                .build();
    }
}
