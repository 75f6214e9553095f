package ai.reviewlens.tools.annotator.utils.config;

/**
 * JSON field names and defaults shared by config import/export and the runtime holder.
 */
public final class ConfigKeys {

    public static final String VERSION = "version";
    public static final String MATCHER = "matcher";
    public static final String AUTOMATON_THRESHOLD = "automatonThreshold";
    public static final String PATTERN_SETS = "patternSets";

    public static final String SET_ID = "id";
    public static final String SET_STYLE = "style";
    public static final String SET_CASE_SENSITIVE = "caseSensitive";
    public static final String SET_PHRASES = "phrases";

    // Theme highlight payload (backend field names)
    public static final String THEME_TYPE = "themeType";
    public static final String THEME_ITEMS = "items";
    public static final String ITEM_CONTENT = "content";
    public static final String ITEM_CONTENT_ORIGINAL = "content_original";

    /** Phrase count at which {@code AUTO} switches from per-phrase scanning to the automaton. */
    public static final int DEFAULT_AUTOMATON_THRESHOLD = 32;

    private ConfigKeys() { }
}
