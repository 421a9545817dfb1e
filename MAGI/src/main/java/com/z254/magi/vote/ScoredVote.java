package com.z254.magi.vote;

/**
 * Normalized vote ready to store.
 *
 * @param score integer in [0, 100]
 * @param rationale stored rationale
 * @param fallback whether the score came from a heuristic rather than the model
 */
public record ScoredVote(int score, String rationale, boolean fallback) {
}
