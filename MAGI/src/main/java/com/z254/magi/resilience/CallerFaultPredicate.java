package com.z254.magi.resilience;

import com.z254.magi.llm.MissingCredentialException;
import com.z254.magi.llm.ProviderException;

import java.util.function.Predicate;

/**
 * Matches provider failures caused by the caller rather than the provider: a missing key, or a
 * 4xx answer to a bad key or bad request. Breakers ignore these so one caller's credentials
 * cannot open a breaker shared by every session. 408 and 429 still count.
 */
public class CallerFaultPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof MissingCredentialException) {
            return true;
        }
        if (throwable instanceof ProviderException providerException) {
            int status = providerException.getStatusCode();
            return status >= 400 && status < 500 && status != 408 && status != 429;
        }
        return false;
    }
}
