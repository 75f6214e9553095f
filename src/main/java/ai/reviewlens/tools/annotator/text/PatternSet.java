package ai.reviewlens.tools.annotator.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Named group of literal phrases sharing one display style.
 *
 * <p>Phrases are kept in declaration order; that order feeds the final overlap tie-break.
 * Blank phrases may be present but are never matched.</p>
 *
 * @param id            caller-defined identifier (theme id, rule name); {@code null} becomes {@code ""}
 * @param phrases       literal phrases; {@code null} and {@code null} entries are dropped
 * @param style         opaque style tag the caller maps to presentation; {@code null} becomes {@code ""}
 * @param caseSensitive whether phrases must match with exact case
 */
public record PatternSet(String id, List<String> phrases, String style, boolean caseSensitive) {

    public PatternSet {
        id = id == null ? "" : id;
        style = style == null ? "" : style;
        phrases = copyNonNull(phrases);
    }

    /** Convenience for a case-sensitive set. */
    public static PatternSet of(String id, String style, String... phrases) {
        return new PatternSet(id, Arrays.asList(phrases), style, true);
    }

    /** Convenience for a case-insensitive set. */
    public static PatternSet ignoringCase(String id, String style, String... phrases) {
        return new PatternSet(id, Arrays.asList(phrases), style, false);
    }

    /**
     * Returns {@code true} when at least one phrase is non-empty after trimming and can therefore match.
     *
     * @return whether the set can produce matches
     */
    public boolean isSearchable() {
        for (String p : phrases) {
            if (isSearchable(p)) return true;
        }
        return false;
    }

    /**
     * Number of phrases that can match; this is the count the automaton threshold compares against.
     *
     * @return searchable phrase count
     */
    public int searchablePhraseCount() {
        int n = 0;
        for (String p : phrases) {
            if (isSearchable(p)) n++;
        }
        return n;
    }

    /** Phrases that are empty after {@link String#trim()} would match everywhere and are ignored. */
    static boolean isSearchable(String phrase) {
        return phrase != null && !phrase.trim().isEmpty();
    }

    private static List<String> copyNonNull(List<String> in) {
        if (in == null || in.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(in.size());
        for (String s : in) {
            if (s != null) out.add(s);
        }
        return List.copyOf(out);
    }

    @Override
    public String toString() {
        return "PatternSet[" + id + ", style=" + style + ", phrases=" + phrases.size()
                + ", caseSensitive=" + caseSensitive + "]";
    }
}
