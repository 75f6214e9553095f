package ai.reviewlens.tools.annotator.themes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import ai.reviewlens.tools.annotator.text.PatternSet;

/**
 * Builds one {@link PatternSet} per preset theme from a review's theme highlights.
 *
 * <p>The translated view highlights the translated labels ({@code content}) with exact case;
 * the original view underlines the verbatim evidence ({@code content_original})
 * case-insensitively. Each set's id and style are the theme id; presentation is looked up
 * through {@link ThemeStyles}.</p>
 */
public final class ThemePatternSets {

    /** Which text of a review the sets will be applied to. */
    public enum Variant {
        TRANSLATED(ThemeItem::content, true),
        ORIGINAL(ThemeItem::contentOriginal, false);

        private final Function<ThemeItem, String> phrase;
        private final boolean caseSensitive;

        Variant(Function<ThemeItem, String> phrase, boolean caseSensitive) {
            this.phrase = phrase;
            this.caseSensitive = caseSensitive;
        }
    }

    private ThemePatternSets() { }

    /**
     * Build sets for all presets, in {@link ThemeType} order.
     *
     * <p>Phrases are trimmed and blank ones dropped. Highlights for unknown theme types are
     * ignored. If a theme appears more than once, the last occurrence that yields at least
     * one phrase wins. Themes without phrases produce an empty set.</p>
     *
     * @param highlights backend highlights (nullable)
     * @param variant    which item text to use
     * @return five sets, one per preset
     */
    public static List<PatternSet> fromHighlights(List<ThemeHighlight> highlights, Variant variant) {
        Map<String, List<String>> byTheme = new HashMap<>();
        if (highlights != null) {
            for (ThemeHighlight h : highlights) {
                if (h == null) continue;
                List<String> phrases = new ArrayList<>();
                for (ThemeItem item : h.items()) {
                    String p = variant.phrase.apply(item);
                    if (p == null) continue;
                    p = p.trim();
                    if (!p.isEmpty()) phrases.add(p);
                }
                if (!phrases.isEmpty()) byTheme.put(h.themeType(), phrases);
            }
        }

        List<PatternSet> out = new ArrayList<>(ThemeType.values().length);
        for (ThemeType t : ThemeType.values()) {
            out.add(new PatternSet(t.id(), byTheme.getOrDefault(t.id(), List.of()), t.id(), variant.caseSensitive));
        }
        return out;
    }
}
