package com.z254.magi.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.magi.config.MagiProperties;
import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.llm.provider.AnthropicProtocol;
import com.z254.magi.llm.provider.ChatProtocol;
import com.z254.magi.llm.provider.GrokProtocol;
import com.z254.magi.llm.provider.OpenAIProtocol;
import com.z254.magi.observability.StructuredLogger;
import com.z254.magi.resilience.ToolSandbox;
import com.z254.magi.tool.AgentTool;
import com.z254.magi.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point for agent invocations across the three providers.
 * Resolves the credential and model, runs the tool loop and bounds the whole exchange
 * with the invocation timeout.
 */
@Slf4j
@Component
public class ProviderClient {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final OpenAIProtocol openai;
    private final AnthropicProtocol anthropic;
    private final GrokProtocol grok;
    private final Map<String, AgentTool> tools = new LinkedHashMap<>();
    private final ToolSandbox sandbox;
    private final ObjectMapper objectMapper;
    private final StructuredLogger structuredLogger;
    private final MagiProperties.LLMProperties config;

    public ProviderClient(OpenAIProtocol openai,
                          AnthropicProtocol anthropic,
                          GrokProtocol grok,
                          List<AgentTool> agentTools,
                          ToolSandbox sandbox,
                          ObjectMapper objectMapper,
                          StructuredLogger structuredLogger,
                          MagiProperties properties) {
        this.openai = openai;
        this.anthropic = anthropic;
        this.grok = grok;
        agentTools.forEach(tool -> tools.put(tool.getName(), tool));
        this.sandbox = sandbox;
        this.objectMapper = objectMapper;
        this.structuredLogger = structuredLogger;
        this.config = properties.getLlm();
    }

    /**
     * Invoke an agent on a conversation.
     *
     * @param agent the agent, selecting provider and model
     * @param credentials per-request API keys
     * @param conversation system and user messages to send
     * @param options invocation switches
     * @return the final assistant text; errors are {@link ProviderInvocationException}s
     */
    public Mono<ProviderInvocation> invoke(Agent agent, ProviderCredentials credentials,
                                           List<LLMRequest.Message> conversation, InvocationOptions options) {
        ProviderType provider = agent.getProvider();
        String apiKey = credentials.keyFor(provider).orElse(null);
        if (apiKey == null) {
            return Mono.error(new MissingCredentialException(provider));
        }
        ChatProtocol protocol = protocolFor(provider);
        String model = resolveModel(agent, protocol);
        Duration timeout = config.getInvocationTimeout();

        return Mono.defer(() -> {
            String conversationId = UUID.randomUUID().toString();
            long startTime = System.currentTimeMillis();
            ToolLoop loop = new ToolLoop(conversationId, protocol, apiKey, model,
                    new ArrayList<>(conversation), options.toolsEnabled());
            return loop.next()
                    .timeout(timeout, Mono.error(new ProviderTimeoutException(provider, timeout)))
                    .onErrorMap(e -> !(e instanceof ProviderInvocationException),
                            e -> new ProviderException(provider,
                                    provider.getId() + " request failed: " + e.getMessage(), e))
                    .doOnSuccess(result -> structuredLogger.logProviderCall(agent.getId(), provider.getId(),
                            model, System.currentTimeMillis() - startTime, result.httpRequestCount(), true))
                    .doOnError(e -> structuredLogger.logProviderCall(agent.getId(), provider.getId(),
                            model, System.currentTimeMillis() - startTime, sandbox.callsMade(conversationId), false))
                    .doFinally(signal -> sandbox.clearConversation(conversationId));
        });
    }

    /**
     * Check a key against the provider's model listing. Failures yield false.
     */
    public Mono<Boolean> ping(ProviderType provider, String apiKey) {
        return protocolFor(provider).ping(apiKey)
                .onErrorReturn(false);
    }

    /**
     * The model an agent's calls are sent with.
     */
    public String modelFor(Agent agent) {
        return resolveModel(agent, protocolFor(agent.getProvider()));
    }

    ChatProtocol protocolFor(ProviderType provider) {
        return switch (provider) {
            case OPENAI -> openai;
            case ANTHROPIC -> anthropic;
            case GROK -> grok;
        };
    }

    static String resolveModel(Agent agent, ChatProtocol protocol) {
        String model = agent.getModel() != null ? agent.getModel().trim() : "";
        return model.isEmpty() ? protocol.getDefaultModel() : model;
    }

    private List<LLMRequest.Tool> advertisedTools() {
        return tools.values().stream()
                .map(tool -> LLMRequest.functionTool(tool.getName(), tool.getDescription(), tool.getParameterSchema()))
                .toList();
    }

    Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(arguments, ARGUMENTS_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.debug("Unparseable tool arguments, using empty object: {}", e.getMessage());
            return Map.of();
        }
    }

    private String serialize(ToolResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.toPayload());
        } catch (JsonProcessingException e) {
            return "{\n  \"ok\" : false,\n  \"error\" : \"Tool result could not be serialized\"\n}";
        }
    }

    /**
     * One conversation with a provider: send, execute requested tools, resend until the model
     * answers without tool calls.
     */
    private final class ToolLoop {
        private final String conversationId;
        private final ChatProtocol protocol;
        private final String apiKey;
        private final String model;
        private final List<LLMRequest.Message> history;
        private final boolean toolsEnabled;

        private ToolLoop(String conversationId, ChatProtocol protocol, String apiKey, String model,
                         List<LLMRequest.Message> history, boolean toolsEnabled) {
            this.conversationId = conversationId;
            this.protocol = protocol;
            this.apiKey = apiKey;
            this.model = model;
            this.history = history;
            this.toolsEnabled = toolsEnabled;
        }

        Mono<ProviderInvocation> next() {
            LLMRequest request = LLMRequest.builder()
                    .model(model)
                    .messages(List.copyOf(history))
                    .tools(toolsEnabled && !tools.isEmpty() ? advertisedTools() : null)
                    .temperature(config.getTemperature())
                    .build();
            return protocol.complete(apiKey, request).flatMap(response -> {
                if (!toolsEnabled || !response.hasToolCalls()) {
                    String content = response.getContent() != null ? response.getContent().trim() : "";
                    return Mono.just(new ProviderInvocation(content, protocol.getProvider(),
                            sandbox.callsMade(conversationId)));
                }
                history.add(LLMRequest.assistantMessage(response.getContent(), response.getToolCalls()));
                return Flux.fromIterable(response.getToolCalls())
                        .concatMap(this::runToolCall)
                        .collectList()
                        .flatMap(results -> {
                            history.addAll(results);
                            return next();
                        });
            });
        }

        private Mono<LLMRequest.Message> runToolCall(LLMRequest.ToolCall call) {
            String name = call.getFunction() != null ? call.getFunction().getName() : null;
            AgentTool tool = name != null ? tools.get(name) : null;
            Mono<ToolResult> result = tool == null
                    ? Mono.just(ToolResult.failure(name, "UNKNOWN_TOOL", "Unknown tool: " + name))
                    : sandbox.execute(conversationId, tool, parseArguments(call.getFunction().getArguments()));
            return result.map(r -> LLMRequest.toolMessage(call.getId(), name, serialize(r)));
        }
    }
}
