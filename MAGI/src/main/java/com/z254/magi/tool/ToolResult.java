package com.z254.magi.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a tool execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    private String toolName;

    private boolean success;

    /**
     * Result content (for successful executions).
     */
    private Object content;

    /**
     * Error code (for failed executions).
     */
    private String errorCode;

    /**
     * Error message (for failed executions).
     */
    private String errorMessage;

    private Duration duration;

    private Instant completedAt;

    public static ToolResult success(String toolName, Object content) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(true)
                .content(content)
                .completedAt(Instant.now())
                .build();
    }

    public static ToolResult failure(String toolName, String errorCode, String errorMessage) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .completedAt(Instant.now())
                .build();
    }

    public static ToolResult timeout(String toolName, Duration timeout) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(false)
                .errorCode("TIMEOUT")
                .errorMessage("Request timed out after " + timeout.toMillis() + "ms")
                .completedAt(Instant.now())
                .duration(timeout)
                .build();
    }

    /**
     * Payload returned to the model: {@code {ok, response}} or {@code {ok, error}}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ok", success);
        if (success) {
            payload.put("response", content);
        } else {
            payload.put("error", errorMessage != null ? errorMessage : "Tool execution failed");
        }
        return payload;
    }
}
