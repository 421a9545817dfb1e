package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCredentialsTest {

    @Test
    @DisplayName("should treat blank keys as missing")
    void blankIsMissing() {
        ProviderCredentials credentials = ProviderCredentials.builder().openai("  ").anthropic("ak").build();

        assertThat(credentials.keyFor(ProviderType.OPENAI)).isEmpty();
        assertThat(credentials.keyFor(ProviderType.ANTHROPIC)).contains("ak");
        assertThat(ProviderCredentials.none().keyFor(ProviderType.GROK)).isEmpty();
    }

    @Test
    @DisplayName("should prefer the grok key over the xai key")
    void grokFallback() {
        assertThat(ProviderCredentials.builder().xai(" xk ").build().keyFor(ProviderType.GROK)).contains("xk");
        assertThat(ProviderCredentials.builder().grok("gk").xai("xk").build().keyFor(ProviderType.GROK)).contains("gk");
    }

    @Test
    @DisplayName("should keep keys out of toString")
    void keysNotPrinted() {
        assertThat(ProviderCredentials.builder().openai("sk-secret").build().toString()).doesNotContain("sk-secret");
    }
}
