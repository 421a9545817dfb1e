package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;
import lombok.Getter;

/**
 * Non-2xx or malformed provider response.
 */
@Getter
public class ProviderException extends ProviderInvocationException {

    /**
     * HTTP status, or 0 when the response could not be interpreted.
     */
    private final int statusCode;

    public ProviderException(ProviderType provider, int statusCode) {
        super(provider, provider.getId() + " error " + statusCode, null);
        this.statusCode = statusCode;
    }

    public ProviderException(ProviderType provider, String message, Throwable cause) {
        super(provider, message, cause);
        this.statusCode = 0;
    }
}
