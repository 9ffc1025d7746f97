package com.cape.core.model;

/**
 * A scored candidate returned by the matcher.
 *
 * @param capabilityId matched capability
 * @param score        relevance in [0, 1]
 * @param kind         which signal produced the match
 */
public record MatchResult(String capabilityId, double score, Kind kind) {

    public enum Kind { EXACT, INTENT, SCORED }
}
