package com.z254.magi.diagnostics;

import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.MessageRole;
import com.z254.magi.domain.model.Vote;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cross-references agents, messages and votes into a {@link StepDiagnostics} report.
 * Holds no state and performs no I/O.
 */
@Component
public class DiagnosticsAggregator {

    static final int PREVIEW_LENGTH = 120;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public StepDiagnostics aggregate(String step, List<Agent> agents, List<Message> messages,
                                     List<Vote> votes, List<String> events) {
        List<Message> proposals = byRole(messages, MessageRole.AGENT_PROPOSAL);
        List<Message> critiques = byRole(messages, MessageRole.AGENT_CRITIQUE);

        List<AgentDiagnostics> agentReports = agents.stream()
                .map(agent -> forAgent(agent, proposals, critiques, votes))
                .toList();

        return StepDiagnostics.builder()
                .step(step)
                .timestamp(Instant.now())
                .totals(new StepDiagnostics.Totals(
                        proposals.size(),
                        critiques.size(),
                        votes.size(),
                        byRole(messages, MessageRole.CONSENSUS).size()))
                .agents(agentReports)
                .events(List.copyOf(events))
                .build();
    }

    private AgentDiagnostics forAgent(Agent agent, List<Message> proposals, List<Message> critiques, List<Vote> votes) {
        String agentId = agent.getId();
        List<Message> ownProposals = proposals.stream()
                .filter(m -> Objects.equals(m.getAgentId(), agentId))
                .toList();
        Set<Long> ownProposalIds = ownProposals.stream()
                .map(Message::getId)
                .collect(Collectors.toSet());

        List<AgentDiagnostics.ProposalSummary> proposalSummaries = ownProposals.stream()
                .map(m -> new AgentDiagnostics.ProposalSummary(m.getId(), m.metaFlag("fallback"), preview(m.getContent())))
                .toList();
        List<AgentDiagnostics.CritiqueSummary> authored = critiques.stream()
                .filter(m -> Objects.equals(m.getAgentId(), agentId))
                .map(DiagnosticsAggregator::critiqueSummary)
                .toList();
        List<AgentDiagnostics.CritiqueSummary> received = critiques.stream()
                .filter(m -> !Objects.equals(m.getAgentId(), agentId))
                .filter(m -> ownProposalIds.contains(m.metaLong("targetMessageId")))
                .map(DiagnosticsAggregator::critiqueSummary)
                .toList();
        List<AgentDiagnostics.VoteSummary> votesCast = votes.stream()
                .filter(v -> Objects.equals(v.getAgentId(), agentId))
                .map(v -> new AgentDiagnostics.VoteSummary(v.getId(), v.getTargetMessageId(), v.getScore(),
                        v.getRationale(), isHeuristic(v.getRationale())))
                .toList();

        int fallbackCount = (int) (proposalSummaries.stream().filter(AgentDiagnostics.ProposalSummary::fallback).count()
                + authored.stream().filter(AgentDiagnostics.CritiqueSummary::fallback).count()
                + votesCast.stream().filter(AgentDiagnostics.VoteSummary::fallback).count());

        return AgentDiagnostics.builder()
                .agentId(agentId)
                .name(agent.getName())
                .provider(agent.getProvider())
                .proposals(proposalSummaries)
                .critiquesAuthored(authored)
                .critiquesReceived(received)
                .votesCast(votesCast)
                .fallbackCount(fallbackCount)
                .build();
    }

    private static AgentDiagnostics.CritiqueSummary critiqueSummary(Message message) {
        return new AgentDiagnostics.CritiqueSummary(message.getId(), message.metaLong("targetMessageId"),
                message.metaFlag("fallback"), preview(message.getContent()));
    }

    private static List<Message> byRole(List<Message> messages, MessageRole role) {
        return messages.stream()
                .filter(m -> m.hasRole(role))
                .toList();
    }

    static boolean isHeuristic(String rationale) {
        return rationale != null && rationale.toLowerCase(Locale.ROOT).contains("heuristic");
    }

    /**
     * Collapse whitespace and cap at {@value #PREVIEW_LENGTH} characters.
     */
    static String preview(String content) {
        if (content == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(content).replaceAll(" ").trim();
        if (collapsed.length() <= PREVIEW_LENGTH) {
            return collapsed;
        }
        return collapsed.substring(0, PREVIEW_LENGTH - 1) + "…";
    }
}
