package ai.reviewlens.tools.annotator.utils.config;

import java.util.ArrayList;
import java.util.List;

import ai.reviewlens.tools.annotator.text.PatternSet;

/**
 * Typed configuration model for import/export and runtime use.
 * Immutable records; list arguments are copied.
 */
public final class ConfigState {

    /** How raw matches are located. */
    public enum MatcherMode {
        /** Per-phrase {@code indexOf} scan. */
        SCAN,
        /** Single Aho–Corasick pass. */
        AUTOMATON,
        /** Automaton once the phrase count reaches the threshold, scan below it. */
        AUTO
    }

    /** Top-level state. */
    public record State(MatcherMode matcher,
                        int automatonThreshold,
                        List<PatternSet> patternSets) { // ordered; order is the tie-break priority

        public State {
            matcher            = matcher == null ? MatcherMode.AUTO : matcher;
            automatonThreshold = automatonThreshold <= 0 ? ConfigKeys.DEFAULT_AUTOMATON_THRESHOLD : automatonThreshold;
            patternSets        = copyNonNull(patternSets);
        }
    }

    /** Default state: {@code AUTO} matcher, default threshold, no configured sets. */
    public static State defaults() {
        return new State(MatcherMode.AUTO, ConfigKeys.DEFAULT_AUTOMATON_THRESHOLD, List.of());
    }

    private static List<PatternSet> copyNonNull(List<PatternSet> in) {
        if (in == null || in.isEmpty()) return List.of();
        List<PatternSet> out = new ArrayList<>(in.size());
        for (PatternSet s : in) {
            if (s != null) out.add(s);
        }
        return List.copyOf(out);
    }

    private ConfigState() { }
}
