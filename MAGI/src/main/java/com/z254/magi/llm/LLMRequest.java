package com.z254.magi.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral chat request. Protocols translate it to their wire format.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LLMRequest {

    /**
     * Resolved model identifier.
     */
    private String model;

    /**
     * Conversation so far, system message first.
     */
    private List<Message> messages;

    /**
     * Tools advertised to the model. Null or empty disables tool use.
     */
    private List<Tool> tools;

    private Double temperature;

    /**
     * Required by the Anthropic messages API, ignored by OpenAI-compatible providers.
     */
    private Integer maxTokens;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }

    /**
     * A message in the conversation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;  // system, user, assistant, tool
        private String content;
        private String name;  // for tool messages
        private String toolCallId;  // for tool results
        private List<ToolCall> toolCalls;  // for assistant messages with tool calls

        public boolean hasToolCalls() {
            return toolCalls != null && !toolCalls.isEmpty();
        }
    }

    /**
     * A tool that the model can call.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tool {
        private String type;  // "function"
        private Function function;
    }

    /**
     * Function definition for tools.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Function {
        private String name;
        private String description;
        private Map<String, Object> parameters;  // JSON Schema
    }

    /**
     * Tool call made by the model.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String type;
        private FunctionCall function;
    }

    /**
     * Function call details.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FunctionCall {
        private String name;
        private String arguments;  // JSON string
    }

    public static Message systemMessage(String content) {
        return Message.builder()
                .role("system")
                .content(content)
                .build();
    }

    public static Message userMessage(String content) {
        return Message.builder()
                .role("user")
                .content(content)
                .build();
    }

    public static Message assistantMessage(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role("assistant")
                .content(content)
                .toolCalls(toolCalls)
                .build();
    }

    public static Message toolMessage(String toolCallId, String name, String content) {
        return Message.builder()
                .role("tool")
                .toolCallId(toolCallId)
                .name(name)
                .content(content)
                .build();
    }

    public static Tool functionTool(String name, String description, Map<String, Object> parameters) {
        return Tool.builder()
                .type("function")
                .function(Function.builder()
                        .name(name)
                        .description(description)
                        .parameters(parameters)
                        .build())
                .build();
    }
}
