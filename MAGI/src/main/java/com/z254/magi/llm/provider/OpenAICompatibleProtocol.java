package com.z254.magi.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.llm.LLMRequest;
import com.z254.magi.llm.LLMResponse;
import com.z254.magi.llm.ProviderException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions protocol shared by OpenAI and xAI Grok.
 */
@Slf4j
public abstract class OpenAICompatibleProtocol implements ChatProtocol {

    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";
    private static final String MODELS_PATH = "/models";
    private static final Duration PING_TIMEOUT = Duration.ofSeconds(10);

    private final ProviderType provider;
    private final String defaultModel;
    private final WebClient webClient;
    private final Timer llmCallTimer;
    private final Counter llmCallCounter;
    private final Counter llmErrorCounter;

    protected OpenAICompatibleProtocol(ProviderType provider, String baseUrl, String defaultModel,
                                       MeterRegistry meterRegistry) {
        this.provider = provider;
        this.defaultModel = defaultModel;
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        this.llmCallTimer = Timer.builder("magi.llm.call.latency")
                .tag("provider", provider.getId())
                .register(meterRegistry);
        this.llmCallCounter = Counter.builder("magi.llm.calls")
                .tag("provider", provider.getId())
                .register(meterRegistry);
        this.llmErrorCounter = Counter.builder("magi.llm.errors")
                .tag("provider", provider.getId())
                .register(meterRegistry);
    }

    @Override
    public ProviderType getProvider() {
        return provider;
    }

    @Override
    public String getDefaultModel() {
        return defaultModel;
    }

    @Override
    public Mono<LLMResponse> complete(String apiKey, LLMRequest request) {
        return Mono.defer(() -> {
            llmCallCounter.increment();
            long startTime = System.currentTimeMillis();
            return webClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .bodyValue(buildRequestBody(request))
                    .exchangeToMono(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            return response.releaseBody()
                                    .then(Mono.error(new ProviderException(provider, response.statusCode().value())));
                        }
                        return response.bodyToMono(JsonNode.class);
                    })
                    .map(json -> parseResponse(json, startTime))
                    .doOnSuccess(response -> {
                        long duration = System.currentTimeMillis() - startTime;
                        llmCallTimer.record(Duration.ofMillis(duration));
                        log.debug("{} completion: {}ms, toolCalls={}", provider.getId(), duration,
                                response != null && response.hasToolCalls());
                    })
                    .doOnError(e -> {
                        llmErrorCounter.increment();
                        log.warn("{} completion error: {}", provider.getId(), e.getMessage());
                    });
        });
    }

    @Override
    public Mono<Boolean> ping(String apiKey) {
        return webClient.get()
                .uri(MODELS_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().is2xxSuccessful()))
                .timeout(PING_TIMEOUT)
                .onErrorReturn(false);
    }

    Map<String, Object> buildRequestBody(LLMRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getModel() != null ? request.getModel() : defaultModel);
        body.put("messages", request.getMessages().stream()
                .map(this::convertMessage)
                .toList());
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

    private Map<String, Object> convertMessage(LLMRequest.Message message) {
        Map<String, Object> msg = new HashMap<>();
        msg.put("role", message.getRole());
        // assistant turns carrying tool calls must still send the content key
        msg.put("content", message.getContent());

        if (message.getName() != null && "tool".equals(message.getRole())) {
            msg.put("name", message.getName());
        }
        if (message.getToolCallId() != null) {
            msg.put("tool_call_id", message.getToolCallId());
        }
        if (message.hasToolCalls()) {
            msg.put("tool_calls", message.getToolCalls().stream()
                    .map(tc -> Map.of(
                            "id", tc.getId(),
                            "type", "function",
                            "function", Map.of(
                                    "name", tc.getFunction().getName(),
                                    "arguments", tc.getFunction().getArguments() != null
                                            ? tc.getFunction().getArguments() : "{}")))
                    .toList());
        }
        return msg;
    }

    private Map<String, Object> convertTool(LLMRequest.Tool tool) {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", tool.getFunction().getName(),
                        "description", tool.getFunction().getDescription(),
                        "parameters", tool.getFunction().getParameters()
                )
        );
    }

    LLMResponse parseResponse(JsonNode json, long startTime) {
        JsonNode message = json.path("choices").path(0).path("message");
        if (message.isMissingNode() || !message.isObject()) {
            throw new ProviderException(provider, provider.getId() + " returned a malformed response", null);
        }
        JsonNode contentNode = message.path("content");
        String content = contentNode.isTextual() ? contentNode.asText() : null;

        List<LLMRequest.ToolCall> toolCalls = null;
        JsonNode toolCallsNode = message.path("tool_calls");
        if (toolCallsNode.isArray() && !toolCallsNode.isEmpty()) {
            toolCalls = new ArrayList<>();
            for (JsonNode tc : toolCallsNode) {
                JsonNode arguments = tc.path("function").path("arguments");
                toolCalls.add(LLMRequest.ToolCall.builder()
                        .id(tc.path("id").asText())
                        .type("function")
                        .function(LLMRequest.FunctionCall.builder()
                                .name(tc.path("function").path("name").asText())
                                .arguments(arguments.isTextual() ? arguments.asText() : arguments.toString())
                                .build())
                        .build());
            }
        }

        return LLMResponse.builder()
                .id(json.path("id").asText(null))
                .model(json.path("model").asText(null))
                .provider(provider)
                .content(content)
                .toolCalls(toolCalls)
                .finishReason(parseFinishReason(json.path("choices").path(0).path("finish_reason").asText("stop")))
                .latencyMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private LLMResponse.FinishReason parseFinishReason(String reason) {
        return switch (reason) {
            case "length" -> LLMResponse.FinishReason.LENGTH;
            case "tool_calls" -> LLMResponse.FinishReason.TOOL_CALLS;
            case "content_filter" -> LLMResponse.FinishReason.CONTENT_FILTER;
            default -> LLMResponse.FinishReason.STOP;
        };
    }
}
