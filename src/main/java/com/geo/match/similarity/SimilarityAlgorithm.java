package com.geo.match.similarity;

/**
 * Interface for text similarity algorithms used to tell apart records that share a location.
 * Implementations return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Similarity as a whole percentage, 0 to 100.
     */
    default int percent(String s1, String s2) {
        return (int) Math.round(compute(s1, s2) * 100.0);
    }

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
