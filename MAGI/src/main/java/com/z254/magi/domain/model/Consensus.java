package com.z254.magi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Consensus record, at most one per session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Consensus {

    private String sessionId;

    /**
     * Id of the consensus message echoing the winning proposal.
     */
    private Long finalMessageId;

    private String summary;

    private Instant createdAt;
}
