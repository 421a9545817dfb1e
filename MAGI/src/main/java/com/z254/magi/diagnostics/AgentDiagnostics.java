package com.z254.magi.diagnostics;

import com.z254.magi.domain.model.ProviderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything one agent contributed to a session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDiagnostics {

    private String agentId;

    private String name;

    private ProviderType provider;

    @Builder.Default
    private List<ProposalSummary> proposals = List.of();

    @Builder.Default
    private List<CritiqueSummary> critiquesAuthored = List.of();

    /**
     * Critiques by other agents targeting this agent's proposals.
     */
    @Builder.Default
    private List<CritiqueSummary> critiquesReceived = List.of();

    @Builder.Default
    private List<VoteSummary> votesCast = List.of();

    /**
     * Fallback flags across proposals, authored critiques and votes cast.
     */
    private int fallbackCount;

    public record ProposalSummary(long id, boolean fallback, String preview) {
    }

    public record CritiqueSummary(long id, Long targetMessageId, boolean fallback, String preview) {
    }

    public record VoteSummary(long id, long targetMessageId, int score, String rationale, boolean fallback) {
    }
}
