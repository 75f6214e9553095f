package ai.reviewlens.tools.annotator.utils.config;

import java.io.IOException;

/**
 * Mapper between the typed {@link ConfigState.State} and the JSON produced/parsed
 * by {@link Json}.
 */
public final class ConfigJsonMapper {

    private ConfigJsonMapper() { }

    /** Build JSON from a typed state using {@link Json} under the hood. */
    public static String build(ConfigState.State state) {
        return Json.buildFromState(state == null ? ConfigState.defaults() : state);
    }

    /** Parse JSON into a typed state via {@link Json#parseConfigJson(String)}. */
    public static ConfigState.State parse(String json) throws IOException {
        return Json.parseConfigJson(json);
    }
}
