package ai.reviewlens.tools.annotator.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns resolved matches into the ordered run list.
 *
 * <p>The concatenation of the returned run texts is always exactly the input text.</p>
 */
public final class SegmentBuilder {

    private SegmentBuilder() {}

    /**
     * Build runs.
     *
     * @param text     subject text; {@code null} is treated as empty
     * @param resolved output of {@link OverlapResolver#resolve(List)}; {@code null} is treated as empty
     * @return runs covering the whole text; empty for empty text, a single plain run when nothing matched
     * @throws IllegalArgumentException if a match lies outside the text or the matches are unordered/overlapping
     */
    public static List<Run> buildRuns(String text, List<Match> resolved) {
        final String subject = text == null ? "" : text;
        final List<Match> matches = resolved == null ? List.of() : resolved;

        final List<Run> runs = new ArrayList<>(matches.size() * 2 + 1);
        int cursor = 0;
        for (Match m : matches) {
            if (m.end() > subject.length()) {
                throw new IllegalArgumentException(
                        "match [" + m.start() + ", " + m.end() + ") exceeds text length " + subject.length());
            }
            if (m.start() < cursor) {
                throw new IllegalArgumentException(
                        "matches must be sorted and non-overlapping: start " + m.start() + " < cursor " + cursor);
            }
            if (m.start() > cursor) {
                runs.add(Run.plain(subject, cursor, m.start()));
            }
            runs.add(Run.annotated(subject, m));
            cursor = m.end();
        }
        if (cursor < subject.length()) {
            runs.add(Run.plain(subject, cursor, subject.length()));
        }
        return Collections.unmodifiableList(runs);
    }
}
