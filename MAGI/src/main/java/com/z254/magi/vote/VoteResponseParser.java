package com.z254.magi.vote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code {score, reason}} from free-form model output.
 * Strategies run in order and the first one yielding a JSON object wins.
 */
@Slf4j
@Component
public class VoteResponseParser {

    private final ObjectMapper objectMapper;

    public VoteResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ParsedVote> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (ExtractionStrategy strategy : ExtractionStrategy.ORDERED) {
            Optional<ParsedVote> parsed = strategy.extract(raw).flatMap(this::readObject);
            if (parsed.isPresent()) {
                log.debug("Vote parsed with {} strategy", strategy.name());
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * Run a single strategy.
     */
    public Optional<ParsedVote> parseWith(ExtractionStrategy strategy, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return strategy.extract(raw).flatMap(this::readObject);
    }

    private Optional<ParsedVote> readObject(String candidate) {
        JsonNode node;
        try {
            node = objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode scoreNode = node.get("score");
        Object score = null;
        if (scoreNode != null && !scoreNode.isNull()) {
            score = scoreNode.isNumber() ? scoreNode.numberValue()
                    : scoreNode.isTextual() ? scoreNode.asText()
                    : scoreNode;
        }
        JsonNode reasonNode = node.get("reason");
        String reason = reasonNode != null && reasonNode.isTextual() && !reasonNode.asText().isEmpty()
                ? reasonNode.asText()
                : null;
        return Optional.of(new ParsedVote(score, reason));
    }

    /**
     * Ways of locating a JSON object in model output.
     */
    public enum ExtractionStrategy {

        /**
         * The whole trimmed reply.
         */
        DIRECT {
            @Override
            Optional<String> extract(String raw) {
                return Optional.of(raw.trim());
            }
        },

        /**
         * The body of the first fenced code block.
         */
        FENCED {
            @Override
            Optional<String> extract(String raw) {
                Matcher matcher = FENCE.matcher(raw);
                return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
            }
        },

        /**
         * From the first opening brace to the last closing brace.
         */
        BRACE_SCAN {
            @Override
            Optional<String> extract(String raw) {
                int start = raw.indexOf('{');
                int end = raw.lastIndexOf('}');
                return start >= 0 && end > start ? Optional.of(raw.substring(start, end + 1)) : Optional.empty();
            }
        };

        static final List<ExtractionStrategy> ORDERED = List.of(DIRECT, FENCED, BRACE_SCAN);
        private static final Pattern FENCE = Pattern.compile("```(?:[a-zA-Z0-9_-]+)?\\s*([\\s\\S]*?)```");

        abstract Optional<String> extract(String raw);
    }
}
