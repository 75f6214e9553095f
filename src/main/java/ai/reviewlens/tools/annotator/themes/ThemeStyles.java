package ai.reviewlens.tools.annotator.themes;

import java.util.Map;

/**
 * Read-only style tables mapping theme ids and preset rule styles to CSS class strings at
 * the render boundary.
 *
 * <p>Unknown colors and custom theme ids fall back to blue.</p>
 */
public final class ThemeStyles {

    static final String FALLBACK_COLOR = "blue";

    // Ids outside ThemeType come from earlier theme models still present in stored reports.
    private static final Map<String, String> THEME_COLORS = Map.of(
            "unmet_needs", "red",
            "pain_points", "orange",
            "benefits", "emerald",
            "features", "amber",
            "comparison", "pink"
    );

    // Style tags of the built-in preset catalogs.
    private static final Map<String, String> PRESET_COLORS = Map.of(
            "positive", "green",
            "negative", "red",
            "brand", "blue",
            "product", "purple",
            "feature", "amber"
    );

    private static final Map<String, String> HIGHLIGHT = Map.of(
            "blue", "bg-blue-100/90 text-blue-900 dark:bg-blue-500/30 dark:text-blue-200",
            "purple", "bg-purple-100/90 text-purple-900 dark:bg-purple-500/30 dark:text-purple-200",
            "green", "bg-green-100/90 text-green-900 dark:bg-green-500/30 dark:text-green-200",
            "red", "bg-red-100/90 text-red-900 dark:bg-red-500/30 dark:text-red-200",
            "orange", "bg-orange-100/90 text-orange-900 dark:bg-orange-500/30 dark:text-orange-200",
            "emerald", "bg-emerald-100/90 text-emerald-900 dark:bg-emerald-500/30 dark:text-emerald-200",
            "amber", "bg-amber-100/90 text-amber-900 dark:bg-amber-500/30 dark:text-amber-200",
            "pink", "bg-pink-100/90 text-pink-900 dark:bg-pink-500/30 dark:text-pink-200",
            "indigo", "bg-indigo-100/90 text-indigo-900 dark:bg-indigo-500/30 dark:text-indigo-200",
            "cyan", "bg-cyan-100/90 text-cyan-900 dark:bg-cyan-500/30 dark:text-cyan-200"
    );

    private static final Map<String, String> UNDERLINE = Map.of(
            "blue", "decoration-blue-600 dark:decoration-blue-400",
            "purple", "decoration-purple-600 dark:decoration-purple-400",
            "green", "decoration-green-600 dark:decoration-green-400",
            "red", "decoration-red-600 dark:decoration-red-400",
            "orange", "decoration-orange-600 dark:decoration-orange-400",
            "emerald", "decoration-emerald-600 dark:decoration-emerald-400",
            "amber", "decoration-amber-600 dark:decoration-amber-400",
            "pink", "decoration-pink-600 dark:decoration-pink-400",
            "indigo", "decoration-indigo-600 dark:decoration-indigo-400",
            "cyan", "decoration-cyan-600 dark:decoration-cyan-400"
    );

    private ThemeStyles() { }

    /**
     * Color key for a theme id or preset rule style.
     *
     * @param themeId theme id, legacy theme id, preset rule style or custom id (nullable)
     * @return color key, {@code "blue"} when unknown
     */
    public static String colorKey(String themeId) {
        ThemeType preset = ThemeType.fromId(themeId);
        if (preset != null) return preset.colorKey();
        if (themeId == null) return FALLBACK_COLOR;
        String legacy = THEME_COLORS.get(themeId);
        if (legacy != null) return legacy;
        return PRESET_COLORS.getOrDefault(themeId, FALLBACK_COLOR);
    }

    /** Background/text classes for highlighted runs of {@code themeId}. */
    public static String highlightClass(String themeId) {
        return HIGHLIGHT.getOrDefault(colorKey(themeId), HIGHLIGHT.get(FALLBACK_COLOR));
    }

    /** Decoration color classes for underlined runs of {@code themeId}. */
    public static String underlineClass(String themeId) {
        return UNDERLINE.getOrDefault(colorKey(themeId), UNDERLINE.get(FALLBACK_COLOR));
    }
}
