package com.geo.match.core.model;

/**
 * Result of a single match lookup.
 *
 * @param rowIndex row in the candidate table
 * @param distance 0 for exact matches, otherwise haversine distance in miles
 */
public record MatchCandidate(int rowIndex, double distance) {

    public static MatchCandidate exact(int rowIndex) {
        return new MatchCandidate(rowIndex, 0.0);
    }

    public boolean isExact() {
        return distance == 0.0;
    }
}
