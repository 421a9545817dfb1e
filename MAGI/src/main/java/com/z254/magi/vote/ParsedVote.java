package com.z254.magi.vote;

/**
 * Fields pulled out of a vote reply, before normalization.
 *
 * @param score the raw score value: a number, a string, another JSON value, or null when absent
 * @param reason the reason when it was a non-empty string, otherwise null
 */
public record ParsedVote(Object score, String reason) {
}
