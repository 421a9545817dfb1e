package com.z254.magi.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PingRequest {

    @NotBlank(message = "provider is required")
    private String provider;

    @ToString.Exclude
    @NotBlank(message = "apiKey is required")
    private String apiKey;
}
