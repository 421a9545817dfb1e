package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Optional;

/**
 * Per-request provider API keys. Never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderCredentials {

    @ToString.Exclude
    private String openai;

    @ToString.Exclude
    private String anthropic;

    @ToString.Exclude
    private String grok;

    /**
     * Legacy name for the Grok key.
     */
    @ToString.Exclude
    private String xai;

    public static ProviderCredentials none() {
        return new ProviderCredentials();
    }

    /**
     * Key for a provider. Blank values count as missing; Grok falls back to the xai key.
     */
    public Optional<String> keyFor(ProviderType provider) {
        return switch (provider) {
            case OPENAI -> nonBlank(openai);
            case ANTHROPIC -> nonBlank(anthropic);
            case GROK -> nonBlank(grok).or(() -> nonBlank(xai));
        };
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
