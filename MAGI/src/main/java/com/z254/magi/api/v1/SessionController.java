package com.z254.magi.api.v1;

import com.z254.magi.api.dto.ApiResponses;
import com.z254.magi.api.dto.CreateSessionRequest;
import com.z254.magi.api.dto.StepRequest;
import com.z254.magi.exception.InvalidRequestException;
import com.z254.magi.service.SessionService;
import com.z254.magi.workflow.StepOutcome;
import com.z254.magi.workflow.WorkflowEngine;
import com.z254.magi.workflow.WorkflowStep;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for deliberation sessions and their workflow steps.
 */
@RestController
@RequestMapping("/api/v1/magi/sessions")
@Tag(name = "Sessions", description = "Three-agent deliberation sessions")
@Slf4j
public class SessionController {

    private final SessionService sessionService;
    private final WorkflowEngine workflowEngine;

    public SessionController(SessionService sessionService, WorkflowEngine workflowEngine) {
        this.sessionService = sessionService;
        this.workflowEngine = workflowEngine;
    }

    @PostMapping
    @Operation(summary = "Create session", description = "Open a session for a question, optionally with a code artifact and a live URL")
    @ApiResponse(responseCode = "200", description = "Session created")
    @ApiResponse(responseCode = "400", description = "Missing user or question, or invalid live URL")
    @ApiResponse(responseCode = "404", description = "Artifact not found")
    @ApiResponse(responseCode = "409", description = "Artifact not ready")
    public Mono<ApiResponses.SessionCreated> createSession(@Valid @RequestBody CreateSessionRequest request) {
        log.info("Creating session for user {}", request.getUserId());
        return sessionService.createSession(request.getUserId(), request.getQuestion(),
                        request.getArtifactId(), request.getLiveUrl())
                .map(session -> new ApiResponses.SessionCreated(session.getId()));
    }

    @GetMapping
    @Operation(summary = "List sessions", description = "List a user's sessions, newest first")
    @ApiResponse(responseCode = "200", description = "Sessions retrieved")
    @ApiResponse(responseCode = "400", description = "Missing user")
    public Mono<ApiResponses.SessionList> listSessions(
            @Parameter(description = "Owning user") @RequestParam(required = false) String userId) {
        return sessionService.listSessions(userId)
                .collectList()
                .map(ApiResponses.SessionList::new);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get session", description = "Session with transcript, votes, consensus and agents")
    @ApiResponse(responseCode = "200", description = "Session found")
    @ApiResponse(responseCode = "404", description = "Session not found")
    public Mono<ApiResponses.SessionDetail> getSession(
            @Parameter(description = "Session ID") @PathVariable String id) {
        return sessionService.getSession(id)
                .map(ApiResponses.SessionDetail::of);
    }

    @PostMapping("/{id}/step")
    @Operation(summary = "Run step", description = "Run propose, vote or consensus with per-request provider keys")
    @ApiResponse(responseCode = "200", description = "Step completed")
    @ApiResponse(responseCode = "400", description = "Unknown step")
    @ApiResponse(responseCode = "404", description = "Session not found")
    @ApiResponse(responseCode = "500", description = "Step failed; diagnostics attached")
    public Mono<StepOutcome> runStep(
            @Parameter(description = "Session ID") @PathVariable String id,
            @Valid @RequestBody StepRequest request) {
        WorkflowStep step = WorkflowStep.fromValue(request.getStep())
                .orElse(null);
        if (step == null) {
            return Mono.error(new InvalidRequestException("Unknown step: " + request.getStep()));
        }
        log.info("Step {} requested for session {}", step.getValue(), id);
        return workflowEngine.runStep(id, step, request.getCredentials());
    }
}
