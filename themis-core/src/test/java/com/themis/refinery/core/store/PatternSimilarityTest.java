package com.themis.refinery.core.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PatternSimilarityTest {

    @Test
    void identicalPatternsAreFullySimilar() {
        assertThat(PatternSimilarity.jaccard("페이지\\s*\\d+ page", "페이지\\s*\\d+ page")).isEqualTo(1.0);
    }

    @Test
    void escapesAndMetacharactersAreIgnored() {
        assertThat(PatternSimilarity.jaccard("(페이지|page)\\s*\\d+", "페이지 page")).isEqualTo(1.0);
    }

    @Test
    void partialOverlapUsesJaccard() {
        // {법원, 판결, 선고} vs {법원, 판결, 이유}: 2 shared of 4
        assertThat(PatternSimilarity.jaccard("법원.*판결.*선고", "법원|판결|이유"))
                .isCloseTo(0.5, within(1e-9));
    }

    @Test
    void patternsWithoutTokensAreNeverSimilar() {
        assertThat(PatternSimilarity.jaccard("\\s{2,}", "\\s{2,}")).isZero();
        assertThat(PatternSimilarity.isDuplicate("\\s{2,}", "\\s{2,}")).isTrue();
    }

    @Test
    void singleCharacterTokensAreDropped() {
        assertThat(PatternSimilarity.tokens("a|bc|d")).containsExactly("bc");
    }
}
