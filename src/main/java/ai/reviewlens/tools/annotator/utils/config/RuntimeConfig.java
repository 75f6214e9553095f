package ai.reviewlens.tools.annotator.utils.config;

import java.util.List;

import ai.reviewlens.tools.annotator.text.PatternSet;
import ai.reviewlens.tools.annotator.utils.Logger;

/**
 * Holds the current runtime configuration used by {@code Annotator.defaults()}.
 *
 * <p>Import actions update this state; annotators created afterwards pick it up.
 * Already constructed annotators keep the settings they were built with.</p>
 */
public final class RuntimeConfig {
    private static volatile ConfigState.State state = ConfigState.defaults();

    private RuntimeConfig() { }

    /** Returns the current runtime config state. */
    public static ConfigState.State getState() {
        return state;
    }

    /** Updates the runtime config state with a normalized, non-null value. */
    public static void updateState(ConfigState.State newState) {
        state = normalize(newState);
        Logger.internalInfo("Runtime config updated: matcher=" + state.matcher()
                + ", threshold=" + state.automatonThreshold()
                + ", patternSets=" + state.patternSets().size());
    }

    /** Restores defaults. */
    public static void reset() {
        state = ConfigState.defaults();
    }

    /** Configured pattern sets that can actually match, in priority order. */
    public static List<PatternSet> searchablePatternSets() {
        return state.patternSets().stream().filter(PatternSet::isSearchable).toList();
    }

    private static ConfigState.State normalize(ConfigState.State incoming) {
        if (incoming == null) {
            return ConfigState.defaults();
        }
        // Record constructors already default null matcher/threshold and copy lists.
        return new ConfigState.State(incoming.matcher(), incoming.automatonThreshold(), incoming.patternSets());
    }
}
