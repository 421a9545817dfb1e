package com.z254.magi.llm.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.magi.config.MagiProperties;
import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.llm.LLMRequest;
import com.z254.magi.llm.LLMResponse;
import com.z254.magi.llm.ProviderException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Anthropic messages API, backing BALTHASAR.
 * The system prompt travels outside the message list and turns are content blocks.
 */
@Slf4j
@Component
public class AnthropicProtocol implements ChatProtocol {

    private static final ProviderType PROVIDER = ProviderType.ANTHROPIC;
    private static final String MESSAGES_PATH = "/messages";
    private static final String MODELS_PATH = "/models";
    private static final Duration PING_TIMEOUT = Duration.ofSeconds(10);
    private static final TypeReference<Map<String, Object>> INPUT_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final MagiProperties.LLMProperties.AnthropicProperties config;
    private final Timer llmCallTimer;
    private final Counter llmCallCounter;
    private final Counter llmErrorCounter;

    public AnthropicProtocol(MagiProperties properties, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.config = properties.getLlm().getAnthropic();
        this.objectMapper = objectMapper;

        this.webClient = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .defaultHeader("anthropic-version", config.getVersion())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        this.llmCallTimer = Timer.builder("magi.llm.call.latency")
                .tag("provider", PROVIDER.getId())
                .register(meterRegistry);
        this.llmCallCounter = Counter.builder("magi.llm.calls")
                .tag("provider", PROVIDER.getId())
                .register(meterRegistry);
        this.llmErrorCounter = Counter.builder("magi.llm.errors")
                .tag("provider", PROVIDER.getId())
                .register(meterRegistry);
    }

    @Override
    public ProviderType getProvider() {
        return PROVIDER;
    }

    @Override
    public String getDefaultModel() {
        return config.getDefaultModel();
    }

    @Override
    @CircuitBreaker(name = "anthropic")
    public Mono<LLMResponse> complete(String apiKey, LLMRequest request) {
        return Mono.defer(() -> {
            llmCallCounter.increment();
            long startTime = System.currentTimeMillis();
            return webClient.post()
                    .uri(MESSAGES_PATH)
                    .header("x-api-key", apiKey)
                    .bodyValue(buildRequestBody(request))
                    .exchangeToMono(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            return response.releaseBody()
                                    .then(Mono.error(new ProviderException(PROVIDER, response.statusCode().value())));
                        }
                        return response.bodyToMono(JsonNode.class);
                    })
                    .map(json -> parseResponse(json, startTime))
                    .doOnSuccess(response -> {
                        long duration = System.currentTimeMillis() - startTime;
                        llmCallTimer.record(Duration.ofMillis(duration));
                        log.debug("Anthropic completion: {}ms, toolCalls={}", duration,
                                response != null && response.hasToolCalls());
                    })
                    .doOnError(e -> {
                        llmErrorCounter.increment();
                        log.warn("Anthropic completion error: {}", e.getMessage());
                    });
        });
    }

    @Override
    public Mono<Boolean> ping(String apiKey) {
        return webClient.get()
                .uri(MODELS_PATH)
                .header("x-api-key", apiKey)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().is2xxSuccessful()))
                .timeout(PING_TIMEOUT)
                .onErrorReturn(false);
    }

    Map<String, Object> buildRequestBody(LLMRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getModel() != null ? request.getModel() : config.getDefaultModel());
        // Max tokens is required for Anthropic
        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens());

        String system = request.getMessages().stream()
                .filter(msg -> "system".equals(msg.getRole()))
                .map(LLMRequest.Message::getContent)
                .filter(content -> content != null && !content.isEmpty())
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            body.put("system", system);
        }
        body.put("messages", convertMessages(request.getMessages()));

        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        if (request.hasTools()) {
            body.put("tools", request.getTools().stream()
                    .map(this::convertTool)
                    .toList());
        }
        return body;
    }

    /**
     * Convert turns to content blocks. Consecutive tool results collapse into one user turn.
     */
    List<Map<String, Object>> convertMessages(List<LLMRequest.Message> messages) {
        List<Map<String, Object>> turns = new ArrayList<>();
        List<Map<String, Object>> pendingResults = new ArrayList<>();
        for (LLMRequest.Message message : messages) {
            if ("system".equals(message.getRole())) {
                continue;
            }
            if ("tool".equals(message.getRole())) {
                pendingResults.add(Map.of(
                        "type", "tool_result",
                        "tool_use_id", message.getToolCallId(),
                        "content", message.getContent() != null ? message.getContent() : ""));
                continue;
            }
            flushToolResults(turns, pendingResults);
            turns.add(convertMessage(message));
        }
        flushToolResults(turns, pendingResults);
        return turns;
    }

    private void flushToolResults(List<Map<String, Object>> turns, List<Map<String, Object>> pendingResults) {
        if (pendingResults.isEmpty()) {
            return;
        }
        turns.add(Map.of("role", "user", "content", List.copyOf(pendingResults)));
        pendingResults.clear();
    }

    private Map<String, Object> convertMessage(LLMRequest.Message message) {
        String role = "assistant".equals(message.getRole()) ? "assistant" : "user";
        List<Map<String, Object>> contentBlocks = new ArrayList<>();
        if (message.getContent() != null && !message.getContent().isEmpty()) {
            contentBlocks.add(Map.of("type", "text", "text", message.getContent()));
        }
        if (message.hasToolCalls()) {
            for (LLMRequest.ToolCall tc : message.getToolCalls()) {
                contentBlocks.add(Map.of(
                        "type", "tool_use",
                        "id", tc.getId(),
                        "name", tc.getFunction().getName(),
                        "input", parseInput(tc.getFunction().getArguments())));
            }
        }
        return Map.of("role", role, "content", contentBlocks);
    }

    private Map<String, Object> parseInput(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> input = objectMapper.readValue(arguments, INPUT_TYPE);
            return input != null ? input : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Map.of();
        }
    }

    private Map<String, Object> convertTool(LLMRequest.Tool tool) {
        return Map.of(
                "name", tool.getFunction().getName(),
                "description", tool.getFunction().getDescription(),
                "input_schema", tool.getFunction().getParameters()
        );
    }

    LLMResponse parseResponse(JsonNode json, long startTime) {
        JsonNode contentArray = json.path("content");
        if (!contentArray.isArray()) {
            throw new ProviderException(PROVIDER, PROVIDER.getId() + " returned a malformed response", null);
        }
        StringBuilder textContent = new StringBuilder();
        List<LLMRequest.ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : contentArray) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                textContent.append(block.path("text").asText());
            } else if ("tool_use".equals(type)) {
                toolCalls.add(LLMRequest.ToolCall.builder()
                        .id(block.path("id").asText())
                        .type("function")
                        .function(LLMRequest.FunctionCall.builder()
                                .name(block.path("name").asText())
                                .arguments(block.has("input") ? block.get("input").toString() : "{}")
                                .build())
                        .build());
            }
        }

        return LLMResponse.builder()
                .id(json.path("id").asText(null))
                .model(json.path("model").asText(null))
                .provider(PROVIDER)
                .content(textContent.length() > 0 ? textContent.toString() : null)
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .finishReason(parseStopReason(json.path("stop_reason").asText("end_turn")))
                .latencyMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private LLMResponse.FinishReason parseStopReason(String reason) {
        return switch (reason) {
            case "max_tokens" -> LLMResponse.FinishReason.LENGTH;
            case "tool_use" -> LLMResponse.FinishReason.TOOL_CALLS;
            default -> LLMResponse.FinishReason.STOP;
        };
    }
}
