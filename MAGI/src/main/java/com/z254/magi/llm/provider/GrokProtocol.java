package com.z254.magi.llm.provider;

import com.z254.magi.config.MagiProperties;
import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.llm.LLMRequest;
import com.z254.magi.llm.LLMResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * xAI Grok through its OpenAI-compatible endpoint, backing MELCHIOR.
 */
@Component
public class GrokProtocol extends OpenAICompatibleProtocol {

    public GrokProtocol(MagiProperties properties, MeterRegistry meterRegistry) {
        super(ProviderType.GROK,
                properties.getLlm().getGrok().getBaseUrl(),
                properties.getLlm().getGrok().getDefaultModel(),
                meterRegistry);
    }

    @Override
    @CircuitBreaker(name = "grok")
    public Mono<LLMResponse> complete(String apiKey, LLMRequest request) {
        return super.complete(apiKey, request);
    }
}
