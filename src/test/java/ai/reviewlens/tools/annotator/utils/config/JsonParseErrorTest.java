package ai.reviewlens.tools.annotator.utils.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import ai.reviewlens.tools.annotator.text.PatternSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies error surfacing: invalid JSON should propagate an IOException, while malformed
 * entries inside valid JSON are skipped with a warning.
 */
class JsonParseErrorTest {

    @Test
    void parse_invalid_json_throwsIOException() {
        String invalid = "{";
        assertThatThrownBy(() -> Json.parseConfigJson(invalid))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> Json.parseThemeHighlights("[{\"themeType\": "))
                .isInstanceOf(IOException.class);
    }

    @Test
    void malformedPatternSetEntry_isSkippedAndWarned() throws Exception {
        ch.qos.logback.classic.Logger internal =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("ai.reviewlens.tools.annotator");
        ListAppender<ILoggingEvent> captured = new ListAppender<>();
        captured.start();
        internal.addAppender(captured);
        try {
            ConfigState.State s = Json.parseConfigJson(
                    "{\"patternSets\":[42,{\"id\":\"ok\",\"style\":\"s\",\"phrases\":[\"a\"]}],\"matcher\":\"nope\"}");

            assertThat(s.patternSets()).extracting(PatternSet::id).containsExactly("ok");
        } finally {
            internal.detachAppender(captured);
        }

        assertThat(captured.list).filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(m -> assertThat(m).contains("Skipping malformed pattern set entry: 42"))
                .anySatisfy(m -> assertThat(m).contains("Unknown matcher 'nope'"));
    }
}
