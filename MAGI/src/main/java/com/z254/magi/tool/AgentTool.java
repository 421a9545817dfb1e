package com.z254.magi.tool;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Interface for tools that agents can call during an invocation.
 */
public interface AgentTool {

    /**
     * Get the tool name advertised to the model.
     *
     * @return tool name
     */
    String getName();

    /**
     * Get the tool description (used by the model to decide when to call it).
     *
     * @return tool description
     */
    String getDescription();

    /**
     * Get the JSON Schema for tool parameters.
     *
     * @return parameter schema as map (JSON Schema format)
     */
    Map<String, Object> getParameterSchema();

    /**
     * Execute the tool with given parameters.
     *
     * @param parameters tool parameters, never null
     * @return tool result, or an error the sandbox turns into a failure result
     */
    Mono<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Validate parameters before execution.
     *
     * @param parameters the parameters to validate
     * @return validation result
     */
    default ValidationResult validate(Map<String, Object> parameters) {
        return ValidationResult.success();
    }

    /**
     * Parameter validation result.
     */
    record ValidationResult(
            boolean valid,
            String message
    ) {
        public static ValidationResult success() {
            return new ValidationResult(true, null);
        }

        public static ValidationResult failure(String message) {
            return new ValidationResult(false, message);
        }
    }
}
