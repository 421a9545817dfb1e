package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;

/**
 * Final text of an agent invocation.
 *
 * @param content trimmed assistant text
 * @param providerUsed provider that produced it
 * @param httpRequestCount relay requests admitted during the tool loop
 */
public record ProviderInvocation(String content, ProviderType providerUsed, int httpRequestCount) {
}
