package ai.reviewlens.tools.annotator.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies {@link CaseFolding} never changes string length and detects split surrogate pairs.
 */
class CaseFoldingTest {

    @Test
    void fold_lowercasesWithoutChangingLength() {
        String in = "ÅBC İstanbul 𐐀 Straße";
        String folded = CaseFolding.fold(in);

        assertThat(folded).hasSize(in.length());
        assertThat(folded).startsWith("åbc i").contains("𐐨").endsWith("straße");
    }

    @Test
    void boundary_rejectsIndexInsideSurrogatePair() {
        String s = "a🎧b";
        assertThat(CaseFolding.isCodePointBoundary(s, 0)).isTrue();
        assertThat(CaseFolding.isCodePointBoundary(s, 1)).isTrue();
        assertThat(CaseFolding.isCodePointBoundary(s, 2)).isFalse();
        assertThat(CaseFolding.isCodePointBoundary(s, 3)).isTrue();
        assertThat(CaseFolding.isCodePointBoundary(s, s.length())).isTrue();
    }
}
