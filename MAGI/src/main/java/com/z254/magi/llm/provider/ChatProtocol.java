package com.z254.magi.llm.provider;

import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.llm.LLMRequest;
import com.z254.magi.llm.LLMResponse;
import reactor.core.publisher.Mono;

/**
 * One request/response exchange with a provider's chat API.
 * The API key is supplied per call; protocols hold no credentials.
 */
public interface ChatProtocol {

    /**
     * The provider this protocol talks to.
     */
    ProviderType getProvider();

    /**
     * Model used when the agent does not name one.
     */
    String getDefaultModel();

    /**
     * Send one chat turn.
     *
     * @param apiKey provider credential
     * @param request the request
     * @return the assistant turn, or an error carrying a
     *         {@link com.z254.magi.llm.ProviderException} for non-2xx and malformed responses
     */
    Mono<LLMResponse> complete(String apiKey, LLMRequest request);

    /**
     * Check that the key is accepted by listing models.
     *
     * @param apiKey provider credential
     * @return true when the provider answered 2xx
     */
    Mono<Boolean> ping(String apiKey);
}
