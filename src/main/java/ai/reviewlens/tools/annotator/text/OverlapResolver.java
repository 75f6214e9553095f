package ai.reviewlens.tools.annotator.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Reduces raw matches to a non-overlapping, start-ordered subset.
 *
 * <p>Policy: earliest start wins; at equal start the longer span wins; at equal span the
 * first-discovered phrase wins (pattern-set order, then phrase order). Candidates are
 * accepted greedily in that order and dropped if they overlap an accepted match
 * (half-open intervals, touching endpoints do not overlap).</p>
 */
public final class OverlapResolver {

    /** Priority order used by the greedy walk. */
    public static final Comparator<Match> PRIORITY = Comparator.comparingInt(Match::start)
            .thenComparing(Comparator.comparingInt(Match::length).reversed())
            .thenComparingInt(Match::order);

    private OverlapResolver() {}

    /**
     * Resolve overlaps.
     *
     * @param matches raw matches in any order; {@code null} is treated as empty
     * @return accepted matches sorted by start, pairwise non-overlapping (never {@code null})
     */
    public static List<Match> resolve(List<Match> matches) {
        if (matches == null || matches.isEmpty()) return List.of();

        final List<Match> sorted = new ArrayList<>(matches);
        sorted.sort(PRIORITY);

        // Accepted matches are ordered by start and disjoint, so the last one has the largest end.
        final List<Match> accepted = new ArrayList<>();
        Match last = null;
        for (Match m : sorted) {
            if (last == null || !m.overlaps(last)) {
                accepted.add(m);
                last = m;
            }
        }
        return Collections.unmodifiableList(accepted);
    }
}
