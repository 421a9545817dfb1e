package com.z254.magi.diagnostics;

import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.MessageRole;
import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.domain.model.Vote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticsAggregatorTest {

    private final DiagnosticsAggregator aggregator = new DiagnosticsAggregator();

    private static final Agent CASPER = Agent.builder().id("a1").name("CASPER").provider(ProviderType.OPENAI).build();
    private static final Agent MELCHIOR = Agent.builder().id("a2").name("MELCHIOR").provider(ProviderType.GROK).build();

    private static Message message(long id, String agentId, MessageRole role, String content, Map<String, Object> meta) {
        return Message.builder()
                .id(id)
                .agentId(agentId)
                .role(role)
                .content(content)
                .meta(new HashMap<>(meta))
                .build();
    }

    private static Vote vote(long id, String agentId, long target, int score, String rationale) {
        return Vote.builder().id(id).agentId(agentId).targetMessageId(target).score(score).rationale(rationale).build();
    }

    @Nested
    @DisplayName("Aggregation")
    class AggregationTests {

        @Test
        @DisplayName("should count messages by role and attribute them to agents")
        void totalsAndAttribution() {
            List<Message> messages = List.of(
                    message(1, null, MessageRole.USER, "Question?", Map.of()),
                    message(2, "a1", MessageRole.AGENT_PROPOSAL, "Casper proposal", Map.of("fallback", false)),
                    message(3, "a2", MessageRole.AGENT_PROPOSAL, "Melchior proposal", Map.of("fallback", true)),
                    message(4, "a2", MessageRole.AGENT_CRITIQUE, "Weak", Map.of("targetMessageId", 2)),
                    message(5, null, MessageRole.CONSENSUS, "Casper proposal", Map.of()));
            List<Vote> votes = List.of(
                    vote(1, "a1", 3, 40, "CASPER heuristic score"),
                    vote(2, "a2", 2, 90, "clear"));

            StepDiagnostics diagnostics = aggregator.aggregate("consensus", List.of(CASPER, MELCHIOR),
                    messages, votes, List.of("event one"));

            assertThat(diagnostics.getStep()).isEqualTo("consensus");
            assertThat(diagnostics.getTotals()).isEqualTo(new StepDiagnostics.Totals(2, 1, 2, 1));
            assertThat(diagnostics.getEvents()).containsExactly("event one");

            AgentDiagnostics casper = diagnostics.getAgents().get(0);
            assertThat(casper.getProposals()).extracting(AgentDiagnostics.ProposalSummary::id).containsExactly(2L);
            assertThat(casper.getCritiquesReceived()).extracting(AgentDiagnostics.CritiqueSummary::id).containsExactly(4L);
            assertThat(casper.getCritiquesAuthored()).isEmpty();
            assertThat(casper.getVotesCast()).singleElement()
                    .satisfies(v -> assertThat(v.fallback()).isTrue());
            assertThat(casper.getFallbackCount()).isEqualTo(1);

            AgentDiagnostics melchior = diagnostics.getAgents().get(1);
            assertThat(melchior.getCritiquesAuthored()).hasSize(1);
            assertThat(melchior.getCritiquesReceived()).isEmpty();
            assertThat(melchior.getFallbackCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report empty sessions")
        void emptySession() {
            StepDiagnostics diagnostics = aggregator.aggregate("propose", List.of(CASPER), List.of(), List.of(), List.of());

            assertThat(diagnostics.getTotals()).isEqualTo(new StepDiagnostics.Totals(0, 0, 0, 0));
            assertThat(diagnostics.getAgents()).singleElement()
                    .satisfies(agent -> assertThat(agent.getProposals()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Previews")
    class PreviewTests {

        @Test
        @DisplayName("should collapse whitespace")
        void collapses() {
            assertThat(DiagnosticsAggregator.preview("  a\n\n b\tc  ")).isEqualTo("a b c");
            assertThat(DiagnosticsAggregator.preview(null)).isEmpty();
        }

        @Test
        @DisplayName("should cap long content with an ellipsis")
        void caps() {
            String preview = DiagnosticsAggregator.preview("x".repeat(500));

            assertThat(preview).hasSize(DiagnosticsAggregator.PREVIEW_LENGTH).endsWith("…");
        }

        @Test
        @DisplayName("should detect heuristic rationales case-insensitively")
        void heuristic() {
            assertThat(DiagnosticsAggregator.isHeuristic("CASPER Heuristic score")).isTrue();
            assertThat(DiagnosticsAggregator.isHeuristic("solid")).isFalse();
            assertThat(DiagnosticsAggregator.isHeuristic(null)).isFalse();
        }
    }
}
