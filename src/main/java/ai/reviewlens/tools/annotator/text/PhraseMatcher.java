package ai.reviewlens.tools.annotator.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every occurrence of every phrase of every pattern set with a per-phrase scan.
 *
 * <h3>Semantics</h3>
 * <ul>
 *   <li>Matches <strong>may overlap</strong>, including self-overlap: after a hit at
 *       {@code i} the next search starts at {@code i + 1}, so {@code "aa"} in {@code "aaaa"}
 *       yields three matches. Resolution happens later in {@link OverlapResolver}.</li>
 *   <li>Case-insensitive sets compare folded copies (see {@link CaseFolding}); offsets always
 *       refer to the original text.</li>
 *   <li>Blank phrases are skipped. Occurrences that would split a surrogate pair are dropped.</li>
 *   <li>Output is in discovery order: set order, phrase order, then ascending start.</li>
 * </ul>
 *
 * <p>{@link PhraseAutomaton} produces the same list in a single pass and is preferable for
 * large phrase lists.</p>
 */
public final class PhraseMatcher {

    private PhraseMatcher() {}

    /**
     * Searchable phrase with its discovery rank and owning set.
     *
     * @param order rank across all searchable phrases of all sets
     * @param key   search key, folded when the set is case-insensitive
     * @param set   owning set
     */
    record Phrase(int order, String key, PatternSet set) {

        Match toMatch(int start) {
            return new Match(start, start + key.length(), set.style(), set.id(), order);
        }
    }

    /**
     * Find all raw matches.
     *
     * @param text subject text; {@code null} is treated as empty
     * @param sets pattern sets in priority order; {@code null} entries are skipped
     * @return raw, possibly overlapping matches (never {@code null})
     */
    public static List<Match> findMatches(String text, List<PatternSet> sets) {
        if (text == null || text.isEmpty()) return List.of();
        final List<Phrase> phrases = phrases(sets);
        if (phrases.isEmpty()) return List.of();

        String folded = null;
        final List<Match> out = new ArrayList<>();
        for (Phrase p : phrases) {
            final String hay;
            if (p.set().caseSensitive()) {
                hay = text;
            } else {
                if (folded == null) folded = CaseFolding.fold(text);
                hay = folded;
            }
            int idx = hay.indexOf(p.key());
            while (idx >= 0) {
                addIfWhole(out, text, p, idx);
                idx = hay.indexOf(p.key(), idx + 1);
            }
        }
        return out;
    }

    /** Flattens sets into ranked, searchable phrases. */
    static List<Phrase> phrases(List<PatternSet> sets) {
        if (sets == null || sets.isEmpty()) return List.of();
        final List<Phrase> out = new ArrayList<>();
        int order = 0;
        for (PatternSet set : sets) {
            if (set == null) continue;
            for (String phrase : set.phrases()) {
                if (!PatternSet.isSearchable(phrase)) continue;
                final String key = set.caseSensitive() ? phrase : CaseFolding.fold(phrase);
                out.add(new Phrase(order++, key, set));
            }
        }
        return out;
    }

    /** Records the occurrence unless it would cut a surrogate pair in half. */
    static void addIfWhole(List<Match> out, String text, Phrase p, int start) {
        final int end = start + p.key().length();
        if (CaseFolding.isCodePointBoundary(text, start) && CaseFolding.isCodePointBoundary(text, end)) {
            out.add(p.toMatch(start));
        }
    }
}
