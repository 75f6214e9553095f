package ai.reviewlens.tools.annotator.utils.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.reviewlens.tools.annotator.text.PatternSet;
import ai.reviewlens.tools.annotator.themes.ThemeHighlight;
import ai.reviewlens.tools.annotator.themes.ThemeItem;
import ai.reviewlens.tools.annotator.utils.Logger;
import ai.reviewlens.tools.annotator.utils.Version;

/**
 * JSON marshaling for annotator config, preset catalogs and backend theme highlights.
 * Produces compact JSON with deterministic field order (stable insertion order).
 * Parsing is lenient: unknown fields are ignored and wrongly typed values are skipped.
 */
public final class Json {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, false); // compact output

    private Json() { }

    /** Dedicated runtime exception for config JSON errors. */
    public static final class ConfigJsonException extends RuntimeException {
        public ConfigJsonException(String message, Throwable cause) { super(message, cause); }
    }

    /* ======================== BUILD (from typed state) ======================== */

    // Package-private: only the typed mapper should call this.
    static String buildFromState(ConfigState.State state) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(ConfigKeys.VERSION, Version.get());
        root.put(ConfigKeys.MATCHER, state.matcher().name());
        root.put(ConfigKeys.AUTOMATON_THRESHOLD, state.automatonThreshold());

        ArrayNode sets = root.putArray(ConfigKeys.PATTERN_SETS);
        for (PatternSet s : state.patternSets()) {
            buildPatternSet(sets.addObject(), s);
        }

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ConfigJsonException("JSON serialization error", e);
        }
    }

    private static void buildPatternSet(ObjectNode node, PatternSet s) {
        node.put(ConfigKeys.SET_ID, s.id());
        node.put(ConfigKeys.SET_STYLE, s.style());
        node.put(ConfigKeys.SET_CASE_SENSITIVE, s.caseSensitive());
        ArrayNode phrases = node.putArray(ConfigKeys.SET_PHRASES);
        for (String p : s.phrases()) {
            phrases.add(p);
        }
    }

    /* ======================== PARSE ===================== */

    /**
     * Parse an exported config document.
     *
     * @param json config JSON
     * @return typed state; missing fields take their defaults
     * @throws IOException if the document is not valid JSON
     */
    public static ConfigState.State parseConfigJson(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return new ConfigState.State(
                parseMatcher(root.path(ConfigKeys.MATCHER)),
                root.path(ConfigKeys.AUTOMATON_THRESHOLD).asInt(ConfigKeys.DEFAULT_AUTOMATON_THRESHOLD),
                parsePatternSets(root.path(ConfigKeys.PATTERN_SETS), true)
        );
    }

    /**
     * Parse the preset catalog resource: an object whose fields are catalog names and whose
     * values are pattern-set arrays. Sets default to case-insensitive when
     * {@code caseSensitive} is absent and {@code defaultCaseSensitive} is {@code false}.
     *
     * @param in resource stream (not closed)
     * @return catalogs in document order
     * @throws IOException if the stream cannot be read or is not valid JSON
     */
    public static Map<String, List<PatternSet>> parseCatalogs(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        Map<String, List<PatternSet>> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode catalog = e.getValue();
            boolean defaultCs = catalog.path("defaultCaseSensitive").asBoolean(true);
            out.put(e.getKey(), parsePatternSets(catalog.path(ConfigKeys.PATTERN_SETS), defaultCs));
        }
        return out;
    }

    /**
     * Parse the backend's per-review theme highlight array.
     *
     * @param json array of {@code {themeType, items:[{content, content_original}]}}
     * @return highlights in document order; a non-array document yields an empty list
     * @throws IOException if the document is not valid JSON
     */
    public static List<ThemeHighlight> parseThemeHighlights(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        List<ThemeHighlight> out = new ArrayList<>();
        if (!root.isArray()) return out;
        for (JsonNode h : root) {
            JsonNode type = h.path(ConfigKeys.THEME_TYPE);
            if (!type.isTextual()) continue;
            List<ThemeItem> items = new ArrayList<>();
            for (JsonNode item : h.path(ConfigKeys.THEME_ITEMS)) {
                items.add(new ThemeItem(
                        textOrNull(item.path(ConfigKeys.ITEM_CONTENT)),
                        textOrNull(item.path(ConfigKeys.ITEM_CONTENT_ORIGINAL))));
            }
            out.add(new ThemeHighlight(type.asText(), items));
        }
        return out;
    }

    /* ----------------------- parse helpers ----------------------- */

    private static ConfigState.MatcherMode parseMatcher(JsonNode node) {
        if (!node.isTextual()) return ConfigState.MatcherMode.AUTO;
        try {
            return ConfigState.MatcherMode.valueOf(node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            Logger.internalWarn("Unknown matcher '" + node.asText() + "', using AUTO");
            return ConfigState.MatcherMode.AUTO;
        }
    }

    private static List<PatternSet> parsePatternSets(JsonNode arr, boolean defaultCaseSensitive) {
        List<PatternSet> out = new ArrayList<>();
        if (!arr.isArray()) return out;
        for (JsonNode n : arr) {
            if (!n.isObject()) {
                Logger.internalWarn("Skipping malformed pattern set entry: " + n);
                continue;
            }
            List<String> phrases = new ArrayList<>();
            for (JsonNode p : n.path(ConfigKeys.SET_PHRASES)) {
                if (p.isTextual()) phrases.add(p.asText());
            }
            JsonNode cs = n.path(ConfigKeys.SET_CASE_SENSITIVE);
            out.add(new PatternSet(
                    n.path(ConfigKeys.SET_ID).asText(""),
                    phrases,
                    n.path(ConfigKeys.SET_STYLE).asText(""),
                    cs.isBoolean() ? cs.asBoolean() : defaultCaseSensitive));
        }
        return out;
    }

    private static String textOrNull(JsonNode n) {
        return n.isTextual() ? n.asText() : null;
    }
}
