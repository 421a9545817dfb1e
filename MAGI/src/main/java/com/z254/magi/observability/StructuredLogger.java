package com.z254.magi.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for MAGI.
 * Provides consistent, machine-parseable log entries with context.
 */
@Component
@Slf4j
public class StructuredLogger {

    private final ObjectMapper objectMapper;

    // MDC keys for context
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_STEP = "step";
    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_PROVIDER_ID = "providerId";

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void logStepStarted(String sessionId, String step) {
        withStepContext(sessionId, step, () -> logEvent("step_started", Map.of(
                "sessionId", sessionId,
                "step", step
        )));
    }

    public void logStepCompleted(String sessionId, String step, long durationMs, Map<String, Object> totals) {
        Map<String, Object> data = new HashMap<>();
        data.put("sessionId", sessionId);
        data.put("step", step);
        data.put("durationMs", durationMs);
        if (totals != null) {
            data.put("totals", totals);
        }
        withStepContext(sessionId, step, () -> logEvent("step_completed", data));
    }

    public void logStepFailed(String sessionId, String step, String errorMessage) {
        withStepContext(sessionId, step, () -> logEvent("step_failed", Map.of(
                "sessionId", sessionId,
                "step", step,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error"
        )));
    }

    /**
     * Log one agent invocation, tool loop included.
     */
    public void logProviderCall(String agentId, String providerId, String model, long durationMs,
                                int httpRequestCount, boolean success) {
        Map<String, String> context = new HashMap<>();
        context.put(MDC_AGENT_ID, agentId);
        context.put(MDC_PROVIDER_ID, providerId);
        withContext(context, () -> logEvent("provider_call", Map.of(
                "agentId", agentId,
                "providerId", providerId,
                "model", model,
                "durationMs", durationMs,
                "httpRequestCount", httpRequestCount,
                "success", success
        )));
    }

    private void withStepContext(String sessionId, String step, Runnable action) {
        Map<String, String> context = new HashMap<>();
        context.put(MDC_SESSION_ID, sessionId);
        context.put(MDC_STEP, step);
        withContext(context, action);
    }

    /**
     * Run {@code action} with the given MDC entries on the calling thread, then restore whatever
     * those keys held before.
     */
    private void withContext(Map<String, String> context, Runnable action) {
        Map<String, String> previous = new HashMap<>();
        context.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            if (value != null) {
                MDC.put(key, value);
            }
        });
        try {
            action.run();
        } finally {
            previous.forEach((key, value) -> {
                if (value != null) {
                    MDC.put(key, value);
                } else {
                    MDC.remove(key);
                }
            });
        }
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "magi");

        String step = MDC.get(MDC_STEP);
        if (step != null) event.putIfAbsent("step", step);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
