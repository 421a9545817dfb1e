package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One assistant turn returned by a provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMResponse {

    private String id;

    private String model;

    private ProviderType provider;

    /**
     * Text content, null when the turn only carries tool calls.
     */
    private String content;

    private List<LLMRequest.ToolCall> toolCalls;

    private FinishReason finishReason;

    private long latencyMs;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public enum FinishReason {
        STOP,
        LENGTH,
        TOOL_CALLS,
        CONTENT_FILTER
    }
}
