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
 * OpenAI chat completions, backing CASPER.
 */
@Component
public class OpenAIProtocol extends OpenAICompatibleProtocol {

    public OpenAIProtocol(MagiProperties properties, MeterRegistry meterRegistry) {
        super(ProviderType.OPENAI,
                properties.getLlm().getOpenai().getBaseUrl(),
                properties.getLlm().getOpenai().getDefaultModel(),
                meterRegistry);
    }

    @Override
    @CircuitBreaker(name = "openai")
    public Mono<LLMResponse> complete(String apiKey, LLMRequest request) {
        return super.complete(apiKey, request);
    }
}
