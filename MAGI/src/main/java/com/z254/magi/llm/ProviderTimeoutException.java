package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;

import java.time.Duration;

/**
 * The invocation, tool loop included, did not finish within the configured timeout.
 */
public class ProviderTimeoutException extends ProviderInvocationException {

    public ProviderTimeoutException(ProviderType provider, Duration timeout) {
        super(provider, provider.getId() + " timeout after " + timeout.toMillis() + "ms", null);
    }
}
