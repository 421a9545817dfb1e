package com.z254.magi.vote;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns vote replies into scores, falling back to a length heuristic when the reply is
 * unusable or the call failed.
 */
@Slf4j
@Component
public class VoteScorer {

    static final int DEFAULT_SCORE = 50;
    static final String DEFAULT_SCORE_NOTE = "heuristic default score";

    private final VoteResponseParser parser;
    private final Counter heuristicCounter;

    public VoteScorer(VoteResponseParser parser, MeterRegistry meterRegistry) {
        this.parser = parser;
        this.heuristicCounter = Counter.builder("magi.votes.heuristic")
                .register(meterRegistry);
    }

    /**
     * Score a reply from {@code agentName} about a proposal.
     */
    public ScoredVote score(String agentName, String reply, String proposalContent) {
        Optional<ParsedVote> parsed = parser.parse(reply);
        if (parsed.isEmpty()) {
            heuristicCounter.increment();
            log.warn("{} vote reply was not JSON, using heuristic score", agentName);
            return new ScoredVote(heuristicScore(proposalContent), agentName + " heuristic score", true);
        }
        return normalize(parsed.get());
    }

    /**
     * Vote for a proposal whose scoring call failed.
     */
    public ScoredVote callFailed(String agentName, String proposalContent) {
        heuristicCounter.increment();
        return new ScoredVote(heuristicScore(proposalContent), agentName + " heuristic score (fallback)", true);
    }

    ScoredVote normalize(ParsedVote vote) {
        Double numeric = toNumber(vote.score());
        if (numeric == null) {
            String rationale = vote.reason() != null
                    ? vote.reason() + " (" + DEFAULT_SCORE_NOTE + ")"
                    : DEFAULT_SCORE_NOTE;
            return new ScoredVote(DEFAULT_SCORE, rationale, true);
        }
        int score = clamp(Math.round(numeric), 0, 100);
        return new ScoredVote(score, vote.reason() != null ? vote.reason() : "", false);
    }

    static int heuristicScore(String proposalContent) {
        int length = proposalContent != null ? proposalContent.length() : 0;
        return clamp(Math.round(Math.sqrt(length)), 30, 90);
    }

    private static Double toNumber(Object score) {
        if (score instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        if (score instanceof String text && !text.isBlank()) {
            try {
                double value = Double.parseDouble(text.trim());
                return Double.isFinite(value) ? value : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static int clamp(long value, int min, int max) {
        return (int) Math.max(min, Math.min(max, value));
    }
}
