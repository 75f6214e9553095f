package ai.reviewlens.tools.annotator.text;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies {@link PhraseAutomaton} finds exactly the matches the per-phrase scan finds.
 */
class PhraseAutomatonTest {

    @Test
    void classicDictionary_findsNestedAndOverlappingPhrases() {
        List<PatternSet> sets = List.of(PatternSet.of("d", "x", "he", "she", "his", "hers"));
        String text = "ushers";

        List<Match> viaAutomaton = PhraseAutomaton.compile(sets).findMatches(text);

        assertThat(viaAutomaton).isEqualTo(PhraseMatcher.findMatches(text, sets));
        assertThat(snippets(text, viaAutomaton)).containsExactly("he", "she", "hers");
    }

    @Test
    void mixedCaseSensitivity_andDuplicatePhrases_matchScan() {
        List<PatternSet> sets = List.of(
                PatternSet.of("brand", "blue", "Echo", "Alexa"),
                PatternSet.ignoringCase("feature", "amber", "battery", "battery life", "echo"),
                PatternSet.ignoringCase("dup", "red", "BATTERY"));
        String text = "My Echo's battery life is great. ECHO battery, Battery!";

        assertThat(PhraseAutomaton.compile(sets).findMatches(text))
                .isEqualTo(PhraseMatcher.findMatches(text, sets))
                .isNotEmpty();
    }

    @Test
    void selfOverlap_matchesScan() {
        List<PatternSet> sets = List.of(PatternSet.of("s", "x", "aa", "aaa"));
        assertThat(PhraseAutomaton.compile(sets).findMatches("aaaaa"))
                .isEqualTo(PhraseMatcher.findMatches("aaaaa", sets))
                .hasSize(7);
    }

    @Test
    void emptyAutomaton_neverMatches() {
        PhraseAutomaton empty = PhraseAutomaton.compile(List.of(PatternSet.of("s", "x", " ", "")));
        assertThat(empty.phraseCount()).isZero();
        assertThat(empty.findMatches("anything")).isEmpty();
        assertThat(PhraseAutomaton.compile(null).findMatches("anything")).isEmpty();
    }

    @Test
    void randomizedInputs_agreeWithScan() {
        String[] alphabet = { "a", "b", "A", "🎧", "é", "É", " " };
        Random rnd = new Random(42);

        for (int round = 0; round < 200; round++) {
            List<PatternSet> sets = new ArrayList<>();
            int setCount = 1 + rnd.nextInt(3);
            for (int s = 0; s < setCount; s++) {
                List<String> phrases = new ArrayList<>();
                int phraseCount = 1 + rnd.nextInt(4);
                for (int p = 0; p < phraseCount; p++) {
                    phrases.add(randomText(rnd, alphabet, 1 + rnd.nextInt(3)));
                }
                sets.add(new PatternSet("set" + s, phrases, "style" + s, rnd.nextBoolean()));
            }
            String text = randomText(rnd, alphabet, rnd.nextInt(30));

            assertThat(PhraseAutomaton.compile(sets).findMatches(text))
                    .as("round %d text '%s'", round, text)
                    .isEqualTo(PhraseMatcher.findMatches(text, sets));
        }
    }

    /* ----------------------------- helpers ----------------------------- */

    private static List<String> snippets(String text, List<Match> matches) {
        List<String> out = new ArrayList<>(matches.size());
        for (Match m : matches) out.add(text.substring(m.start(), m.end()));
        return out;
    }

    private static String randomText(Random rnd, String[] alphabet, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(alphabet[rnd.nextInt(alphabet.length)]);
        }
        return sb.toString();
    }
}
