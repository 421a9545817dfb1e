package com.z254.magi.llm;

import com.z254.magi.domain.model.ProviderType;

/**
 * No API key was supplied for the agent's provider. Raised before any network call.
 */
public class MissingCredentialException extends ProviderInvocationException {

    public MissingCredentialException(ProviderType provider) {
        super(provider, "Missing key for " + provider.getId(), null);
    }
}
