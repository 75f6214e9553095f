package ai.reviewlens.tools.annotator.text;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the overlap policy in {@link OverlapResolver}:
 * earliest start, then longest span, then first-declared phrase.
 */
class OverlapResolverTest {

    @Test
    void selfOverlap_keepsAlternatingMatches() {
        List<Match> raw = PhraseMatcher.findMatches("aaaa", List.of(PatternSet.of("s", "x", "aa")));
        assertThat(raw).hasSize(3);

        List<Match> resolved = OverlapResolver.resolve(raw);
        assertThat(resolved).extracting(Match::start).containsExactly(0, 2);
    }

    @Test
    void sameStart_longerSpanWins() {
        String text = "battery life is great";
        List<PatternSet> sets = List.of(
                PatternSet.of("short", "amber", "battery"),
                PatternSet.of("long", "green", "battery life"));

        List<Match> resolved = OverlapResolver.resolve(PhraseMatcher.findMatches(text, sets));

        assertThat(resolved).hasSize(1);
        Match m = resolved.get(0);
        assertThat(text.substring(m.start(), m.end())).isEqualTo("battery life");
        assertThat(m.sourceSetId()).isEqualTo("long");
    }

    @Test
    void sameSpan_firstDeclaredSetWins() {
        List<PatternSet> sets = List.of(
                PatternSet.of("first", "green", "good"),
                PatternSet.of("second", "red", "good"));

        List<Match> resolved = OverlapResolver.resolve(PhraseMatcher.findMatches("so good", sets));

        assertThat(resolved).extracting(Match::sourceSetId).containsExactly("first");
    }

    @Test
    void earlierStart_beatsLongerLaterMatch() {
        String text = "good value for money";
        List<PatternSet> sets = List.of(PatternSet.of("s", "x", "value for money", "good value"));

        List<Match> resolved = OverlapResolver.resolve(PhraseMatcher.findMatches(text, sets));

        assertThat(resolved).hasSize(1);
        assertThat(text.substring(resolved.get(0).start(), resolved.get(0).end())).isEqualTo("good value");
    }

    @Test
    void touchingEndpoints_doNotOverlap() {
        List<Match> resolved = OverlapResolver.resolve(List.of(
                new Match(3, 6, "b", "s", 1),
                new Match(0, 3, "a", "s", 0)));

        assertThat(resolved).extracting(Match::start).containsExactly(0, 3);
    }

    @Test
    void containedMatch_isDropped() {
        List<Match> resolved = OverlapResolver.resolve(List.of(
                new Match(0, 10, "outer", "s", 1),
                new Match(2, 4, "inner", "s", 0)));

        assertThat(resolved).extracting(Match::style).containsExactly("outer");
    }

    @Test
    void output_isSortedAndPairwiseDisjoint() {
        String text = "the sound quality and the sound are great, quality sound";
        List<PatternSet> sets = List.of(
                PatternSet.ignoringCase("a", "x", "sound", "quality", "sound quality"),
                PatternSet.ignoringCase("b", "y", "d q", "and the", "great, q"));

        List<Match> resolved = OverlapResolver.resolve(PhraseMatcher.findMatches(text, sets));

        assertThat(resolved).isNotEmpty();
        for (int i = 1; i < resolved.size(); i++) {
            assertThat(resolved.get(i - 1).end()).isLessThanOrEqualTo(resolved.get(i).start());
        }
    }

    @Test
    void resolve_isIdempotent() {
        String text = "aaaa battery life aaaa";
        List<PatternSet> sets = List.of(
                PatternSet.of("s", "x", "aa", "battery", "a b"),
                PatternSet.of("t", "y", "battery life", "e a"));

        List<Match> once = OverlapResolver.resolve(PhraseMatcher.findMatches(text, sets));
        List<Match> twice = OverlapResolver.resolve(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void inputOrder_doesNotChangeResult() {
        List<Match> raw = new ArrayList<>(PhraseMatcher.findMatches("abcabc",
                List.of(PatternSet.of("s", "x", "abc", "bca", "ca", "c"))));
        List<Match> reversed = new ArrayList<>(raw);
        Collections.reverse(reversed);

        assertThat(OverlapResolver.resolve(reversed)).isEqualTo(OverlapResolver.resolve(raw));
    }

    @Test
    void emptyInput_yieldsEmptyOutput() {
        assertThat(OverlapResolver.resolve(List.of())).isEmpty();
        assertThat(OverlapResolver.resolve(null)).isEmpty();
    }
}
