package com.z254.magi.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Inspectable report of a session after a workflow step.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepDiagnostics {

    private String step;

    private Instant timestamp;

    private Totals totals;

    @Builder.Default
    private List<AgentDiagnostics> agents = List.of();

    /**
     * Human-readable event log of the step, in emission order.
     */
    @Builder.Default
    private List<String> events = List.of();

    private Long winningProposalId;

    private Integer winningScore;

    private Long consensusMessageId;

    /**
     * Message and vote counts.
     */
    public record Totals(int proposals, int critiques, int votes, int consensus) {
    }
}
