package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;
import lombok.Getter;

/**
 * Base type for failures of a single agent invocation.
 */
@Getter
public abstract class ProviderInvocationException extends RuntimeException {

    private final ProviderType provider;

    protected ProviderInvocationException(ProviderType provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
