package com.z254.magi.context;

/**
 * Repository context rendered from an uploaded bundle.
 *
 * @param text manifest summary followed by the selected snippets
 * @param approxTokens summed token estimate of the selected chunks
 * @param chunkCount selected chunks
 * @param fileCount distinct files among the selected chunks
 * @param truncated whether selection left candidates out
 */
public record ArtifactContext(String text, int approxTokens, int chunkCount, int fileCount, boolean truncated) {
}
