package com.geo.match.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Token-sort similarity.
 * Both strings are lower-cased, stripped of punctuation and non-ASCII characters,
 * split into tokens and re-joined in sorted order before a sequence comparison,
 * so word order does not affect the score.
 */
public class TokenSortSimilarity implements SimilarityAlgorithm {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SimilarityAlgorithm sequence;

    public TokenSortSimilarity() {
        this(new SequenceMatcherSimilarity());
    }

    public TokenSortSimilarity(SimilarityAlgorithm sequence) {
        this.sequence = sequence;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return sequence.compute(sortTokens(s1), sortTokens(s2));
    }

    /**
     * Dissimilarity on a 0 to 100 scale: {@code 100 - percent(s1, s2)}.
     */
    public int dissimilarity(String s1, String s2) {
        return 100 - percent(s1, s2);
    }

    @Override
    public String getName() {
        return "TokenSort";
    }

    static String sortTokens(String s) {
        String cleaned = NON_ALPHANUMERIC.matcher(s.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return "";
        }
        String[] tokens = WHITESPACE.split(cleaned);
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}
