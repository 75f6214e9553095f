package ai.reviewlens.tools.annotator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.reviewlens.tools.annotator.text.Match;
import ai.reviewlens.tools.annotator.text.OverlapResolver;
import ai.reviewlens.tools.annotator.text.PatternSet;
import ai.reviewlens.tools.annotator.text.PhraseAutomaton;
import ai.reviewlens.tools.annotator.text.PhraseMatcher;
import ai.reviewlens.tools.annotator.text.Run;
import ai.reviewlens.tools.annotator.text.SegmentBuilder;
import ai.reviewlens.tools.annotator.utils.Logger;
import ai.reviewlens.tools.annotator.utils.config.ConfigState;
import ai.reviewlens.tools.annotator.utils.config.RuntimeConfig;

/**
 * Entry point for annotating review text.
 *
 * <p>{@code annotate(text, sets)} is {@code buildRuns(text, resolve(findMatches(text, sets)))}.
 * The result depends only on the arguments, so callers may memoize on {@code (text, sets)}.
 * The matcher strategy changes how matches are found, never which.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class Annotator {

    private final ConfigState.MatcherMode mode;
    private final int automatonThreshold;

    /**
     * @param mode               matcher strategy; {@code null} means {@code AUTO}
     * @param automatonThreshold phrase count at which {@code AUTO} uses the automaton; non-positive means the default
     */
    public Annotator(ConfigState.MatcherMode mode, int automatonThreshold) {
        ConfigState.State normalized = new ConfigState.State(mode, automatonThreshold, List.of());
        this.mode = normalized.matcher();
        this.automatonThreshold = normalized.automatonThreshold();
    }

    /** Annotator using the current {@link RuntimeConfig} settings. */
    public static Annotator defaults() {
        ConfigState.State s = RuntimeConfig.getState();
        return new Annotator(s.matcher(), s.automatonThreshold());
    }

    public ConfigState.MatcherMode mode() {
        return mode;
    }

    public int automatonThreshold() {
        return automatonThreshold;
    }

    /**
     * Annotate {@code text} with all given sets.
     *
     * @param text subject text; {@code null} is treated as empty
     * @param sets pattern sets in priority order (nullable)
     * @return runs reproducing {@code text}; empty for empty text
     */
    public List<Run> annotate(String text, List<PatternSet> sets) {
        return annotateMatches(text, findMatches(text, sets));
    }

    /**
     * Annotate {@code text} with only the sets whose id is active.
     *
     * @param text      subject text; {@code null} is treated as empty
     * @param sets      candidate sets in priority order (nullable)
     * @param activeIds ids of the enabled sets; {@code null} or empty disables all
     * @return runs reproducing {@code text}
     */
    public List<Run> annotate(String text, List<PatternSet> sets, Collection<String> activeIds) {
        return annotate(text, activeSets(sets, activeIds));
    }

    /**
     * Annotate with a precompiled automaton, for callers that reuse one set list across many texts.
     *
     * @param text      subject text; {@code null} is treated as empty
     * @param automaton compiled phrases
     * @return runs reproducing {@code text}
     */
    public List<Run> annotate(String text, PhraseAutomaton automaton) {
        Objects.requireNonNull(automaton, "automaton");
        return annotateMatches(text, automaton.findMatches(text));
    }

    /** Annotate with the pattern sets held in {@link RuntimeConfig}. */
    public List<Run> annotateConfigured(String text) {
        return annotate(text, RuntimeConfig.searchablePatternSets());
    }

    /**
     * Raw matches using this annotator's strategy.
     *
     * @param text subject text; {@code null} is treated as empty
     * @param sets pattern sets in priority order (nullable)
     * @return raw, possibly overlapping matches in discovery order
     */
    public List<Match> findMatches(String text, List<PatternSet> sets) {
        if (text == null || text.isEmpty() || sets == null || sets.isEmpty()) return List.of();
        return useAutomaton(sets)
                ? PhraseAutomaton.compile(sets).findMatches(text)
                : PhraseMatcher.findMatches(text, sets);
    }

    /**
     * Filters {@code sets} down to the active, searchable ones, preserving order.
     *
     * @param sets      candidate sets (nullable)
     * @param activeIds enabled ids (nullable)
     * @return active sets
     */
    public static List<PatternSet> activeSets(List<PatternSet> sets, Collection<String> activeIds) {
        if (sets == null || sets.isEmpty() || activeIds == null || activeIds.isEmpty()) return List.of();
        final Set<String> active = new HashSet<>();
        for (String id : activeIds) {
            if (id != null) active.add(id);
        }
        final List<PatternSet> out = new ArrayList<>();
        for (PatternSet s : sets) {
            if (s != null && active.contains(s.id()) && s.isSearchable()) out.add(s);
        }
        return out;
    }

    private List<Run> annotateMatches(String text, List<Match> raw) {
        final List<Match> resolved = OverlapResolver.resolve(raw);
        final List<Run> runs = SegmentBuilder.buildRuns(text, resolved);
        if (Logger.isDebugEnabled()) {
            Logger.internalDebug("annotate: length=" + (text == null ? 0 : text.length())
                    + ", raw=" + raw.size() + ", resolved=" + resolved.size() + ", runs=" + runs.size());
        }
        return runs;
    }

    boolean useAutomaton(List<PatternSet> sets) {
        return switch (mode) {
            case SCAN -> false;
            case AUTOMATON -> true;
            case AUTO -> searchablePhraseCount(sets) >= automatonThreshold;
        };
    }

    private static int searchablePhraseCount(List<PatternSet> sets) {
        int n = 0;
        for (PatternSet s : sets) {
            if (s != null) n += s.searchablePhraseCount();
        }
        return n;
    }
}
