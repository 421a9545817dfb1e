package com.z254.magi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One agent's score for another agent's proposal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vote {

    private Long id;

    private String sessionId;

    /**
     * Voting agent.
     */
    private String agentId;

    /**
     * Id of the agent_proposal message being scored.
     */
    private Long targetMessageId;

    /**
     * Integer score in [0, 100].
     */
    private int score;

    private String rationale;

    private Instant createdAt;
}
