package com.z254.magi.workflow;

import com.z254.magi.context.AssembledContext;
import com.z254.magi.context.ContextAssembler;
import com.z254.magi.diagnostics.DiagnosticsAggregator;
import com.z254.magi.diagnostics.StepDiagnostics;
import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.Consensus;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.MessageRole;
import com.z254.magi.domain.model.Session;
import com.z254.magi.domain.model.SessionSnapshot;
import com.z254.magi.domain.model.SessionStatus;
import com.z254.magi.domain.model.Vote;
import com.z254.magi.domain.repository.SessionRepository;
import com.z254.magi.exception.ResourceNotFoundException;
import com.z254.magi.exception.StepFailedException;
import com.z254.magi.llm.InvocationOptions;
import com.z254.magi.llm.ProviderClient;
import com.z254.magi.llm.ProviderCredentials;
import com.z254.magi.llm.ProviderInvocation;
import com.z254.magi.observability.StructuredLogger;
import com.z254.magi.vote.ScoredVote;
import com.z254.magi.vote.VoteScorer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Drives the propose, vote and consensus steps over a session.
 *
 * <p>Each call runs one step to completion. Steps are not guarded against re-entry:
 * running a step twice records its messages and votes twice.
 *
 * <ul>
 *   <li>propose: every agent answers the question with the assembled context; any agent
 *       failure aborts the step and marks the session as errored</li>
 *   <li>vote: every agent scores every other agent's proposal; failed calls fall back to a
 *       length heuristic so the step always completes</li>
 *   <li>consensus: the proposal with the strictly greatest vote total is echoed as the
 *       consensus message</li>
 * </ul>
 */
@Slf4j
@Component
public class WorkflowEngine {

    static final String NO_PROPOSALS = "No proposals available for consensus";

    private final SessionRepository sessionRepository;
    private final ContextAssembler contextAssembler;
    private final ProviderClient providerClient;
    private final PromptFactory promptFactory;
    private final VoteScorer voteScorer;
    private final DiagnosticsAggregator diagnosticsAggregator;
    private final StructuredLogger structuredLogger;
    private final MeterRegistry meterRegistry;

    public WorkflowEngine(SessionRepository sessionRepository,
                          ContextAssembler contextAssembler,
                          ProviderClient providerClient,
                          PromptFactory promptFactory,
                          VoteScorer voteScorer,
                          DiagnosticsAggregator diagnosticsAggregator,
                          StructuredLogger structuredLogger,
                          MeterRegistry meterRegistry) {
        this.sessionRepository = sessionRepository;
        this.contextAssembler = contextAssembler;
        this.providerClient = providerClient;
        this.promptFactory = promptFactory;
        this.voteScorer = voteScorer;
        this.diagnosticsAggregator = diagnosticsAggregator;
        this.structuredLogger = structuredLogger;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run one workflow step.
     *
     * @param sessionId the session to advance
     * @param step the step to run
     * @param credentials per-request provider keys
     * @return the step payload with fresh diagnostics; fails with {@link ResourceNotFoundException}
     *         for an unknown session and {@link StepFailedException} when the step aborts
     */
    public Mono<StepOutcome> runStep(String sessionId, WorkflowStep step, ProviderCredentials credentials) {
        return sessionRepository.getSessionFull(sessionId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException.session(sessionId)))
                .flatMap(snapshot -> {
                    StepRun run = new StepRun(step, snapshot,
                            credentials != null ? credentials : ProviderCredentials.none());
                    structuredLogger.logStepStarted(sessionId, step.getValue());
                    log.info("Running {} for session {} with {} agents",
                            step.getValue(), sessionId, snapshot.getAgents().size());

                    return execute(run)
                            .onErrorResume(e -> !(e instanceof StepFailedException), e -> abort(run, e))
                            .doOnSuccess(outcome -> {
                                long elapsed = run.elapsedMs();
                                recordStep(step, "success", elapsed);
                                structuredLogger.logStepCompleted(sessionId, step.getValue(), elapsed,
                                        totalsOf(outcome.getDiagnostics()));
                            })
                            .doOnError(e -> {
                                recordStep(step, "failure", run.elapsedMs());
                                structuredLogger.logStepFailed(sessionId, step.getValue(), e.getMessage());
                            });
                });
    }

    private Mono<StepOutcome> execute(StepRun run) {
        return switch (run.step) {
            case PROPOSE -> propose(run);
            case VOTE -> vote(run);
            case CONSENSUS -> consensus(run);
        };
    }

    // ------------------------------------------------------------------
    // propose
    // ------------------------------------------------------------------

    private Mono<StepOutcome> propose(StepRun run) {
        Session session = run.snapshot.getSession();
        String question = run.snapshot.question();
        List<Agent> agents = run.snapshot.getAgents();

        return sessionRepository.setSessionStatus(run.sessionId(), SessionStatus.RUNNING, null)
                .then(Mono.defer(() -> contextAssembler.assemble(session.getArtifactId(), session.getLiveUrl(), question)))
                .defaultIfEmpty(AssembledContext.EMPTY)
                .flatMap(context -> {
                    run.event(describeContext(context));
                    return Flux.fromIterable(agents)
                            .flatMapSequential(agent -> draftProposal(run, agent, question, context))
                            .collectList()
                            .flatMapMany(Flux::fromIterable)
                            .concatMap(draft -> storeProposal(run, draft, context))
                            .collectList();
                })
                .flatMap(stored -> finish(run, (fresh, outcome) ->
                        outcome.proposals(fresh.messagesWithRole(MessageRole.AGENT_PROPOSAL))));
    }

    private Mono<ProposalDraft> draftProposal(StepRun run, Agent agent, String question, AssembledContext context) {
        return Mono.defer(() -> providerClient.invoke(agent, run.credentials,
                        promptFactory.proposal(agent, question, context), InvocationOptions.withTools()))
                .filter(invocation -> invocation.content() != null && !invocation.content().isBlank())
                .switchIfEmpty(Mono.error(new IllegalStateException("empty response")))
                .map(invocation -> new ProposalDraft(agent, invocation))
                .onErrorMap(e -> {
                    String reason = agent.getName() + " proposal failed: " + e.getMessage();
                    run.event("[" + agent.getName() + "] proposal failed: " + e.getMessage());
                    log.warn("Proposal from {} failed: {}", agent.getName(), e.getMessage());
                    return new AgentCallFailure(reason, e);
                });
    }

    private Mono<Message> storeProposal(StepRun run, ProposalDraft draft, AssembledContext context) {
        Agent agent = draft.agent();
        ProviderInvocation invocation = draft.invocation();
        String actualProvider = invocation.providerUsed() != null
                ? invocation.providerUsed().getId()
                : agent.getProvider().getId();

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("provider", agent.getProvider().getId());
        meta.put("stage", "proposal");
        meta.put("fallback", false);
        meta.put("actualProvider", actualProvider);
        meta.put("httpRequestCount", invocation.httpRequestCount());
        meta.put("contextChars", context.length());
        meta.put("contextChunks", context.getChunkCount());
        meta.put("artifactTrimmed", context.isArtifactTrimmed());
        meta.put("liveTrimmed", context.isLiveTrimmed());

        Message message = Message.builder()
                .sessionId(run.sessionId())
                .agentId(agent.getId())
                .role(MessageRole.AGENT_PROPOSAL)
                .content(invocation.content().trim())
                .model(providerClient.modelFor(agent))
                .meta(meta)
                .build();

        return sessionRepository.addMessage(message)
                .doOnNext(stored -> run.event(String.format("[%s] proposal stored as #%d via %s%s",
                        agent.getName(), stored.getId(), actualProvider,
                        invocation.httpRequestCount() > 0
                                ? " after " + invocation.httpRequestCount() + " HTTP request(s)"
                                : "")));
    }

    private static String describeContext(AssembledContext context) {
        if (!context.hasArtifact() && !context.hasLive()) {
            return "No artifact or live context attached";
        }
        return String.format("Context assembled: %d chars (~%d tokens), %d chunks from %d files%s%s",
                context.length(), context.getApproxTokens(), context.getChunkCount(), context.getFileCount(),
                context.isArtifactTrimmed() ? ", artifact trimmed" : "",
                context.isLiveTrimmed() ? ", live snapshot trimmed" : "");
    }

    // ------------------------------------------------------------------
    // vote
    // ------------------------------------------------------------------

    private Mono<StepOutcome> vote(StepRun run) {
        List<Message> proposals = run.snapshot.messagesWithRole(MessageRole.AGENT_PROPOSAL);
        String question = run.snapshot.question();

        List<Ballot> ballots = new ArrayList<>();
        for (Agent agent : run.snapshot.getAgents()) {
            List<Message> targets = proposals.stream()
                    .filter(proposal -> !Objects.equals(proposal.getAgentId(), agent.getId()))
                    .toList();
            if (targets.isEmpty()) {
                run.event("[" + agent.getName() + "] no proposals from other agents to score; skipped");
                continue;
            }
            targets.forEach(target -> ballots.add(new Ballot(agent, target)));
        }
        log.debug("Casting {} votes over {} proposals", ballots.size(), proposals.size());

        return Flux.fromIterable(ballots)
                .flatMap(ballot -> castVote(run, question, ballot))
                .concatMap(cast -> storeVote(run, cast))
                .collectList()
                .flatMap(stored -> finish(run, (fresh, outcome) -> outcome.votes(fresh.getVotes())));
    }

    private Mono<CastVote> castVote(StepRun run, String question, Ballot ballot) {
        Agent agent = ballot.agent();
        Message target = ballot.target();
        return Mono.defer(() -> providerClient.invoke(agent, run.credentials,
                        promptFactory.vote(agent, question, target), InvocationOptions.plain()))
                .map(invocation -> voteScorer.score(agent.getName(), invocation.content(), target.getContent()))
                .switchIfEmpty(Mono.fromSupplier(() -> voteScorer.callFailed(agent.getName(), target.getContent())))
                .onErrorResume(e -> {
                    log.warn("Vote by {} on #{} failed, using heuristic: {}", agent.getName(), target.getId(), e.getMessage());
                    run.event(String.format("[%s] vote on #%d failed (%s); heuristic fallback",
                            agent.getName(), target.getId(), e.getMessage()));
                    return Mono.just(voteScorer.callFailed(agent.getName(), target.getContent()));
                })
                .map(scored -> new CastVote(ballot, scored));
    }

    private Mono<Vote> storeVote(StepRun run, CastVote cast) {
        Agent agent = cast.ballot().agent();
        Message target = cast.ballot().target();
        Vote vote = Vote.builder()
                .sessionId(run.sessionId())
                .agentId(agent.getId())
                .targetMessageId(target.getId())
                .score(cast.scored().score())
                .rationale(cast.scored().rationale())
                .build();
        return sessionRepository.addVote(vote)
                .doOnNext(stored -> run.event(String.format("[%s] scored #%d: %d%s",
                        agent.getName(), target.getId(), stored.getScore(),
                        cast.scored().fallback() ? " (heuristic)" : "")));
    }

    // ------------------------------------------------------------------
    // consensus
    // ------------------------------------------------------------------

    private Mono<StepOutcome> consensus(StepRun run) {
        List<Message> proposals = run.snapshot.messagesWithRole(MessageRole.AGENT_PROPOSAL);
        if (proposals.isEmpty()) {
            run.event(NO_PROPOSALS);
            log.warn("Session {} has no proposals, consensus not reached", run.sessionId());
            return sessionRepository.setSessionStatus(run.sessionId(), SessionStatus.ERROR, NO_PROPOSALS)
                    .then(Mono.defer(() -> finish(run, (fresh, outcome) -> outcome.error(NO_PROPOSALS))));
        }

        Map<Long, Integer> totals = new HashMap<>();
        run.snapshot.getVotes().forEach(vote -> totals.merge(vote.getTargetMessageId(), vote.getScore(), Integer::sum));

        Message winner = null;
        int bestScore = 0;
        for (Message proposal : proposals) {
            int total = totals.getOrDefault(proposal.getId(), 0);
            if (winner == null || total > bestScore) {
                winner = proposal;
                bestScore = total;
            }
        }

        Message chosen = winner;
        int winningScore = bestScore;
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("fromMessageId", chosen.getId());
        meta.put("totalScore", winningScore);
        Message consensusMessage = Message.builder()
                .sessionId(run.sessionId())
                .role(MessageRole.CONSENSUS)
                .content(chosen.getContent())
                .meta(meta)
                .build();

        return sessionRepository.addMessage(consensusMessage)
                .flatMap(stored -> sessionRepository.upsertConsensus(Consensus.builder()
                                .sessionId(run.sessionId())
                                .finalMessageId(stored.getId())
                                .build())
                        .then(sessionRepository.setSessionStatus(run.sessionId(), SessionStatus.CONSENSUS, null))
                        .then(Mono.defer(() -> {
                            run.winningProposalId = chosen.getId();
                            run.winningScore = winningScore;
                            run.consensusMessageId = stored.getId();
                            run.event(String.format("Proposal #%d selected with total score %d; consensus stored as #%d",
                                    chosen.getId(), winningScore, stored.getId()));
                            return finish(run, (fresh, outcome) -> outcome
                                    .finalMessageId(stored.getId())
                                    .finalMessage(fresh.findMessage(stored.getId()).orElse(stored)));
                        })));
    }

    // ------------------------------------------------------------------
    // completion and failure
    // ------------------------------------------------------------------

    private Mono<StepOutcome> finish(StepRun run, BiConsumer<SessionSnapshot, StepOutcome.StepOutcomeBuilder> payload) {
        return readFresh(run)
                .map(fresh -> {
                    StepOutcome.StepOutcomeBuilder outcome = StepOutcome.builder()
                            .step(run.step)
                            .next(run.step.next())
                            .status(fresh.getSession().getStatus())
                            .diagnostics(diagnose(run, fresh));
                    payload.accept(fresh, outcome);
                    return outcome.build();
                });
    }

    private Mono<StepOutcome> abort(StepRun run, Throwable error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("Step {} failed for session {}: {}", run.step.getValue(), run.sessionId(), reason);

        return sessionRepository.setSessionStatus(run.sessionId(), SessionStatus.ERROR, reason)
                .then(Mono.defer(() -> readFresh(run)))
                .map(fresh -> Optional.of(diagnose(run, fresh)))
                .onErrorResume(recordError -> {
                    log.warn("Could not record failure of session {}: {}", run.sessionId(), recordError.getMessage());
                    return Mono.just(Optional.empty());
                })
                .flatMap(diagnostics -> Mono.error(new StepFailedException(
                        run.step.getValue(), reason, diagnostics.orElse(null), error)));
    }

    private Mono<SessionSnapshot> readFresh(StepRun run) {
        return sessionRepository.getSessionFull(run.sessionId())
                .switchIfEmpty(Mono.error(ResourceNotFoundException.session(run.sessionId())));
    }

    private StepDiagnostics diagnose(StepRun run, SessionSnapshot fresh) {
        StepDiagnostics diagnostics = diagnosticsAggregator.aggregate(run.step.getValue(), fresh.getAgents(),
                fresh.getMessages(), fresh.getVotes(), run.events());
        if (run.consensusMessageId == null) {
            return diagnostics;
        }
        return diagnostics.toBuilder()
                .winningProposalId(run.winningProposalId)
                .winningScore(run.winningScore)
                .consensusMessageId(run.consensusMessageId)
                .build();
    }

    private static Map<String, Object> totalsOf(StepDiagnostics diagnostics) {
        if (diagnostics == null || diagnostics.getTotals() == null) {
            return null;
        }
        StepDiagnostics.Totals totals = diagnostics.getTotals();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("proposals", totals.proposals());
        result.put("critiques", totals.critiques());
        result.put("votes", totals.votes());
        result.put("consensus", totals.consensus());
        return result;
    }

    private void recordStep(WorkflowStep step, String outcome, long elapsedMs) {
        Timer.builder("magi.workflow.step")
                .tag("step", step.getValue())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(Duration.ofMillis(elapsedMs));
    }

    /**
     * Mutable state of one step execution.
     */
    private static final class StepRun {
        private final WorkflowStep step;
        private final SessionSnapshot snapshot;
        private final ProviderCredentials credentials;
        private final List<String> events = Collections.synchronizedList(new ArrayList<>());
        private final long startedAt = System.currentTimeMillis();
        private Long winningProposalId;
        private Integer winningScore;
        private Long consensusMessageId;

        private StepRun(WorkflowStep step, SessionSnapshot snapshot, ProviderCredentials credentials) {
            this.step = step;
            this.snapshot = snapshot;
            this.credentials = credentials;
        }

        String sessionId() {
            return snapshot.getSession().getId();
        }

        void event(String event) {
            events.add(event);
        }

        List<String> events() {
            synchronized (events) {
                return List.copyOf(events);
            }
        }

        long elapsedMs() {
            return System.currentTimeMillis() - startedAt;
        }
    }

    private record ProposalDraft(Agent agent, ProviderInvocation invocation) {
    }

    private record Ballot(Agent agent, Message target) {
    }

    private record CastVote(Ballot ballot, ScoredVote scored) {
    }

    /**
     * A proposal call failed; the message names the agent.
     */
    private static final class AgentCallFailure extends RuntimeException {
        private AgentCallFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
