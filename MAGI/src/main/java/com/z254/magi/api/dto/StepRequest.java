package com.z254.magi.api.dto;

import com.z254.magi.llm.ProviderCredentials;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for triggering a workflow step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepRequest {

    /**
     * One of propose, vote or consensus.
     */
    @NotBlank(message = "step is required")
    private String step;

    private ProviderCredentials credentials;
}
