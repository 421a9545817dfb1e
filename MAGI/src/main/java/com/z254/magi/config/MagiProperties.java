package com.z254.magi.config;

import com.z254.magi.domain.model.ProviderType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the MAGI service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "magi")
public class MagiProperties {

    private LLMProperties llm = new LLMProperties();
    private ContextProperties context = new ContextProperties();
    private RelayProperties relay = new RelayProperties();
    private List<AgentSeed> agents = new ArrayList<>(List.of(
            new AgentSeed("casper", "CASPER", ProviderType.OPENAI, "gpt-5.1", "#38bdf8"),
            new AgentSeed("balthasar", "BALTHASAR", ProviderType.ANTHROPIC, "claude-sonnet-4-5", "#f472b6"),
            new AgentSeed("melchior", "MELCHIOR", ProviderType.GROK, "grok-4-fast-reasoning", "#facc15")
    ));

    @Data
    public static class LLMProperties {
        private double temperature = 0.3;
        private Duration invocationTimeout = Duration.ofSeconds(20);
        private OpenAIProperties openai = new OpenAIProperties();
        private AnthropicProperties anthropic = new AnthropicProperties();
        private GrokProperties grok = new GrokProperties();

        @Data
        public static class OpenAIProperties {
            private String baseUrl = "https://api.openai.com/v1";
            private String defaultModel = "gpt-5.1";
        }

        @Data
        public static class AnthropicProperties {
            private String baseUrl = "https://api.anthropic.com/v1";
            private String defaultModel = "claude-sonnet-4-5";
            private String version = "2023-06-01";
            private int maxTokens = 1024;
        }

        @Data
        public static class GrokProperties {
            private String baseUrl = "https://api.x.ai/v1";
            private String defaultModel = "grok-4-fast-reasoning";
        }
    }

    @Data
    public static class ContextProperties {
        /**
         * Upper bound for artifact plus live context, in characters.
         */
        private int charBudget = 26_000;
        private double artifactShare = 0.65;
        private int artifactFloor = 12_000;
        private int liveFloor = 4_000;
        private int maxChunks = 1_200;
        private int priorityChunkLimit = 400;
        private int generalChunkLimit = 200;
        private LiveProperties live = new LiveProperties();

        @Data
        public static class LiveProperties {
            private int maxChars = 12_000;
            private Duration fetchTimeout = Duration.ofSeconds(8);
            private int maxFetchBytes = 256 * 1024;
        }
    }

    @Data
    public static class RelayProperties {
        private int maxCallsPerConversation = 5;
        private Duration timeout = Duration.ofSeconds(8);
        private int maxResponseBytes = 256 * 1024;
        private int maxRequestBodyBytes = 64 * 1024;
        /**
         * Allows loopback, private network targets and non-default ports. Local testing only.
         */
        private boolean allowLocalTargets = false;
    }

    /**
     * Default agent roster seeded into the session repository.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentSeed {
        private String slug;
        private String name;
        private ProviderType provider;
        private String model;
        private String color;
    }
}
