package com.z254.magi.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.z254.magi.diagnostics.StepDiagnostics;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.SessionStatus;
import com.z254.magi.domain.model.Vote;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of a workflow step. Payload fields are present only for the step that produces them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepOutcome {

    @Builder.Default
    private boolean ok = true;

    private WorkflowStep step;

    /**
     * Suggested next step, absent after consensus.
     */
    private WorkflowStep next;

    /**
     * Session status after the step.
     */
    private SessionStatus status;

    private List<Message> proposals;

    private List<Vote> votes;

    private Long finalMessageId;

    private Message finalMessage;

    /**
     * Recorded failure that did not abort the step.
     */
    private String error;

    private StepDiagnostics diagnostics;
}
