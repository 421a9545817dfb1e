package com.z254.magi.live;

import reactor.core.publisher.Mono;

/**
 * Builds a text snapshot of a live site for agent prompts.
 */
public interface LiveSiteContextBuilder {

    /**
     * Fetch the URL and render it as prompt text. Fetch failures are reported inside the
     * returned text rather than as errors.
     *
     * @param liveUrl the raw or normalized URL
     * @return the snapshot text, or empty when the URL is unusable
     */
    Mono<String> buildLiveUrlContext(String liveUrl);
}
