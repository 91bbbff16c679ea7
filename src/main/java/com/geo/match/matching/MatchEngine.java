package com.geo.match.matching;

import com.geo.match.core.model.GeoPoint;
import com.geo.match.core.model.MatchCandidate;
import com.geo.match.core.model.Table;
import com.geo.match.geo.GeoDistance;
import com.geo.match.similarity.TokenSortSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Finds the best candidate row in a table for one source location.
 *
 * <p>Matching rules, in order:</p>
 * <ol>
 *   <li>An unresolved source location never matches.</li>
 *   <li>Candidates are rows with a resolved location that are not consumed
 *       (consumption only counts when matching is exclusive).</li>
 *   <li>A single candidate at exactly the source location wins with distance 0.</li>
 *   <li>Several candidates at exactly the source location are told apart by their
 *       compare columns: the one with the smallest sum of squared token-sort
 *       dissimilarities wins, with distance 0.</li>
 *   <li>Otherwise the nearest candidate by planar proxy is checked with the haversine
 *       formula and wins if it lies within the radius (inclusive).</li>
 * </ol>
 *
 * <p>Stateless and not synchronized; a merge drives it from a single thread.</p>
 */
public class MatchEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final TokenSortSimilarity similarity;

    public MatchEngine() {
        this(new TokenSortSimilarity());
    }

    public MatchEngine(TokenSortSimilarity similarity) {
        this.similarity = similarity;
    }

    /**
     * Finds the best match for a source location among the rows of {@code candidates}.
     *
     * @param source         location of the row being matched
     * @param sourceCompare  compare-column values of the row being matched
     * @param candidates     table to search; must carry coordinates
     * @param consumed       rows of {@code candidates} already matched in this pass
     * @param exclusive      whether consumed rows are skipped
     * @param radiusMiles    maximum haversine distance for a non-exact match
     * @return the chosen row and its distance, or empty if nothing qualifies
     */
    public Optional<MatchCandidate> findBestMatch(GeoPoint source, List<String> sourceCompare,
                                                  Table candidates, BitSet consumed,
                                                  boolean exclusive, double radiusMiles) {
        if (!source.isResolved()) {
            return Optional.empty();
        }

        List<Integer> exact = new ArrayList<>();
        int nearest = -1;
        double nearestProxy = Double.POSITIVE_INFINITY;

        for (int row = 0; row < candidates.rowCount(); row++) {
            if (exclusive && consumed.get(row)) {
                continue;
            }
            GeoPoint point = candidates.coordinate(row);
            if (!point.isResolved()) {
                continue;
            }
            if (source.coincidesWith(point)) {
                exact.add(row);
                continue;
            }
            if (!exact.isEmpty()) {
                continue;
            }
            double proxy = GeoDistance.planarProxy(source, point);
            if (proxy < nearestProxy) {
                nearestProxy = proxy;
                nearest = row;
            }
        }

        if (exact.size() == 1) {
            return Optional.of(MatchCandidate.exact(exact.get(0)));
        }
        if (exact.size() > 1) {
            return Optional.of(MatchCandidate.exact(breakTie(exact, sourceCompare, candidates)));
        }
        if (nearest < 0) {
            return Optional.empty();
        }

        double distance = GeoDistance.haversine(source, candidates.coordinate(nearest));
        if (distance > radiusMiles) {
            return Optional.empty();
        }
        return Optional.of(new MatchCandidate(nearest, distance));
    }

    /**
     * Picks the exact candidate whose compare values sit closest to the source's.
     * For each of a candidate's compare values, the smallest dissimilarity to any
     * source value is squared and summed. The first candidate with the lowest sum wins.
     */
    int breakTie(List<Integer> exact, List<String> sourceCompare, Table candidates) {
        int best = exact.get(0);
        long bestScore = Long.MAX_VALUE;

        for (int row : exact) {
            long score = 0;
            for (String candidateValue : candidates.compareRow(row)) {
                int closest = Integer.MAX_VALUE;
                for (String sourceValue : sourceCompare) {
                    closest = Math.min(closest, similarity.dissimilarity(sourceValue, candidateValue));
                }
                if (closest != Integer.MAX_VALUE) {
                    score += (long) closest * closest;
                }
            }
            if (score < bestScore) {
                bestScore = score;
                best = row;
            }
        }

        log.debug("match.tieBreak candidates={} chosen={} score={}", exact.size(), best, bestScore);
        return best;
    }
}
