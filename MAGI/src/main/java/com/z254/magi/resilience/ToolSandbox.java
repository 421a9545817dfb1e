package com.z254.magi.resilience;

import com.z254.magi.config.MagiProperties;
import com.z254.magi.tool.AgentTool;
import com.z254.magi.tool.ToolResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sandbox for tool execution inside an agent conversation.
 * Enforces the per-conversation call cap and turns every tool failure into a result,
 * so a misbehaving tool never fails the invocation. Calls rejected by validation do not
 * count against the cap.
 */
@Component
@Slf4j
public class ToolSandbox {

    private final MagiProperties.RelayProperties config;
    private final Timer toolExecutionTimer;
    private final Counter toolTimeoutCounter;
    private final Counter toolErrorCounter;

    // Track tool calls per conversation
    private final Map<String, AtomicInteger> conversationUsage = new ConcurrentHashMap<>();

    public ToolSandbox(MagiProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.getRelay();

        this.toolExecutionTimer = Timer.builder("magi.tool.sandbox.execution")
                .register(meterRegistry);
        this.toolTimeoutCounter = Counter.builder("magi.tool.sandbox.timeouts")
                .register(meterRegistry);
        this.toolErrorCounter = Counter.builder("magi.tool.sandbox.errors")
                .register(meterRegistry);
    }

    /**
     * Execute a tool call on behalf of a conversation.
     */
    public Mono<ToolResult> execute(String conversationId, AgentTool tool, Map<String, Object> parameters) {
        String toolName = tool.getName();

        AgentTool.ValidationResult validation = tool.validate(parameters);
        if (!validation.valid()) {
            log.warn("Invalid parameters for tool {}: {}", toolName, validation.message());
            return Mono.just(ToolResult.failure(toolName, "INVALID_PARAMS", validation.message()));
        }

        SandboxCheckResult check = reserveCall(conversationId);
        if (!check.isAllowed()) {
            log.warn("Tool quota exceeded for conversation {}: {}", conversationId, check.getReason());
            return Mono.just(ToolResult.failure(toolName, "QUOTA_EXCEEDED", check.getReason()));
        }

        Duration timeout = config.getTimeout();
        Instant startTime = Instant.now();
        log.debug("Executing tool {} in sandbox (timeout: {})", toolName, timeout);

        return Mono.defer(() -> tool.execute(parameters))
                .timeout(timeout)
                .doOnSuccess(result -> {
                    Duration elapsed = Duration.between(startTime, Instant.now());
                    toolExecutionTimer.record(elapsed);
                    log.debug("Tool {} completed in {}ms", toolName, elapsed.toMillis());
                })
                .onErrorResume(e -> {
                    if (e instanceof TimeoutException) {
                        toolTimeoutCounter.increment();
                        log.warn("Tool {} timed out after {}", toolName, timeout);
                        return Mono.just(ToolResult.timeout(toolName, timeout));
                    }
                    toolErrorCounter.increment();
                    log.warn("Tool {} failed: {}", toolName, e.getMessage());
                    return Mono.just(ToolResult.failure(toolName, "EXECUTION_ERROR",
                            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
                });
    }

    /**
     * Count a call against the conversation's quota if there is room left.
     */
    public SandboxCheckResult reserveCall(String conversationId) {
        AtomicInteger usage = conversationUsage.computeIfAbsent(conversationId, k -> new AtomicInteger());
        int max = config.getMaxCallsPerConversation();
        int used = usage.getAndUpdate(current -> current < max ? current + 1 : current);
        if (used >= max) {
            return SandboxCheckResult.denied(
                    "HTTP request limit reached (" + max + " per conversation)");
        }
        return SandboxCheckResult.allowed(max - used - 1);
    }

    /**
     * Calls performed so far in a conversation.
     */
    public int callsMade(String conversationId) {
        AtomicInteger usage = conversationUsage.get(conversationId);
        return usage != null ? usage.get() : 0;
    }

    /**
     * Clear usage tracking for a finished conversation.
     */
    public void clearConversation(String conversationId) {
        conversationUsage.remove(conversationId);
    }

    /**
     * Sandbox check result.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SandboxCheckResult {
        private boolean allowed;
        private String reason;
        private int remaining;

        public static SandboxCheckResult allowed(int remaining) {
            return SandboxCheckResult.builder()
                    .allowed(true)
                    .remaining(remaining)
                    .build();
        }

        public static SandboxCheckResult denied(String reason) {
            return SandboxCheckResult.builder()
                    .allowed(false)
                    .reason(reason)
                    .remaining(0)
                    .build();
        }
    }
}
