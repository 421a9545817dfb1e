package com.z254.magi.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for opening a deliberation session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "question is required")
    @Size(max = 20000, message = "question must be less than 20000 characters")
    private String question;

    /**
     * Processed code bundle owned by the same user.
     */
    private String artifactId;

    /**
     * Site to snapshot; normalized before it is stored.
     */
    private String liveUrl;
}
