package com.z254.magi.context;

import lombok.Builder;
import lombok.Value;

/**
 * Budgeted background material for the propose step.
 */
@Value
@Builder
public class AssembledContext {

    public static final AssembledContext EMPTY = AssembledContext.builder()
            .artifactText("")
            .liveText("")
            .build();

    /**
     * Repository context, empty when no artifact is attached.
     */
    String artifactText;

    /**
     * Live-site snapshot, empty when no URL is attached.
     */
    String liveText;

    int approxTokens;
    int chunkCount;
    int fileCount;

    /**
     * Chunk selection left candidates out.
     */
    boolean artifactTruncated;

    /**
     * Artifact text was cut during rebalancing.
     */
    boolean artifactTrimmed;

    /**
     * Live text was cut during rebalancing.
     */
    boolean liveTrimmed;

    public boolean hasArtifact() {
        return !artifactText.isEmpty();
    }

    public boolean hasLive() {
        return !liveText.isEmpty();
    }

    /**
     * Combined character count of both sides.
     */
    public int length() {
        return artifactText.length() + liveText.length();
    }
}
