package com.geo.match.similarity;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp sequence similarity.
 * Computes similarity as 2 * M / T, where M is the number of characters in the
 * recursively found longest common blocks and T is the total length of both strings.
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        int matches = matchingCharacters(s1, s2);
        return 2.0 * matches / (s1.length() + s2.length());
    }

    @Override
    public String getName() {
        return "SequenceMatcher";
    }

    /**
     * Sums the lengths of the matching blocks: find the longest common substring,
     * then repeat on the pieces to its left and to its right.
     */
    int matchingCharacters(String a, String b) {
        int total = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});

        while (!ranges.isEmpty()) {
            int[] r = ranges.pop();
            int[] block = longestCommonBlock(a, r[0], r[1], b, r[2], r[3]);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            total += size;
            int aStart = block[0];
            int bStart = block[1];
            if (r[0] < aStart && r[2] < bStart) {
                ranges.push(new int[]{r[0], aStart, r[2], bStart});
            }
            if (aStart + size < r[1] && bStart + size < r[3]) {
                ranges.push(new int[]{aStart + size, r[1], bStart + size, r[3]});
            }
        }
        return total;
    }

    /**
     * Longest common substring of a[aLo, aHi) and b[bLo, bHi).
     * Ties go to the block starting earliest in {@code a}, then earliest in {@code b}.
     *
     * @return {aStart, bStart, length}
     */
    private int[] longestCommonBlock(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];
        int bestA = aLo;
        int bestB = bLo;
        int bestSize = 0;

        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = j - bLo + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    current[k] = previous[k - 1] + 1;
                    if (current[k] > bestSize) {
                        bestSize = current[k];
                        bestA = i - bestSize + 1;
                        bestB = j - bestSize + 1;
                    }
                } else {
                    current[k] = 0;
                }
            }
            int[] temp = previous;
            previous = current;
            current = temp;
        }
        return new int[]{bestA, bestB, bestSize};
    }
}
