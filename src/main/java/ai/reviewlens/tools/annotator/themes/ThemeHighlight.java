package ai.reviewlens.tools.annotator.themes;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-review theme extraction result as delivered by the backend.
 *
 * @param themeType theme id, e.g. {@code "who"}
 * @param items     evidence items; {@code null} becomes empty, {@code null} entries are dropped
 */
public record ThemeHighlight(String themeType, List<ThemeItem> items) {

    public ThemeHighlight {
        themeType = themeType == null ? "" : themeType;
        if (items == null) {
            items = List.of();
        } else {
            List<ThemeItem> copy = new ArrayList<>(items.size());
            for (ThemeItem i : items) {
                if (i != null) copy.add(i);
            }
            items = List.copyOf(copy);
        }
    }
}
