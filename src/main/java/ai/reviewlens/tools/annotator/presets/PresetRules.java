package ai.reviewlens.tools.annotator.presets;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import ai.reviewlens.tools.annotator.text.PatternSet;
import ai.reviewlens.tools.annotator.utils.Logger;
import ai.reviewlens.tools.annotator.utils.config.Json;

/**
 * Built-in rule catalogs (sentiment, brand, product and feature vocabularies) used when a
 * review has no AI-extracted themes.
 *
 * <p>Catalogs are read once from {@value #RESOURCE} on first use.</p>
 */
public final class PresetRules {

    static final String RESOURCE = "/presets/rules.json";

    /** Named catalogs in the resource. */
    public enum Catalog {
        /** Chinese sentiment/product vocabulary for the translated text, rendered as highlights. */
        HIGHLIGHT("highlight"),
        /** English vocabulary for the original text, rendered as underlines. */
        UNDERLINE("underline");

        private final String key;

        Catalog(String key) { this.key = key; }

        public String key() { return key; }
    }

    private PresetRules() { }

    /**
     * Pattern sets of a catalog, in priority order.
     *
     * @param catalog catalog to read
     * @return immutable list of sets
     * @throws IllegalStateException if the resource is missing, unreadable, or lacks the catalog
     */
    public static List<PatternSet> catalog(Catalog catalog) {
        List<PatternSet> sets = Holder.CATALOGS.get(catalog.key());
        if (sets == null) {
            throw new IllegalStateException("Preset catalog not found: " + catalog.key());
        }
        return sets;
    }

    static Map<String, List<PatternSet>> load(String resource) {
        try (InputStream in = PresetRules.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Preset resource missing: " + resource);
            }
            Map<String, List<PatternSet>> parsed = Json.parseCatalogs(in);
            Logger.internalDebug("Loaded preset catalogs " + parsed.keySet() + " from " + resource);
            return Map.copyOf(parsed);
        } catch (IOException e) {
            Logger.logError("Failed to read preset resource " + resource, e);
            throw new IllegalStateException("Preset resource unreadable: " + resource, e);
        }
    }

    private static final class Holder {
        static final Map<String, List<PatternSet>> CATALOGS = load(RESOURCE);
    }
}
