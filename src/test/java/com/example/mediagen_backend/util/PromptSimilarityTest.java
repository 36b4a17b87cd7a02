package com.example.mediagen_backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PromptSimilarityTest {

    @Test
    void identicalPromptsScoreOneRegardlessOfCaseAndPunctuation() {
        assertThat(PromptSimilarity.jaccard("A red fox, jumping!", "a RED fox jumping")).isEqualTo(1.0);
    }

    @Test
    void partialOverlapIsIntersectionOverUnion() {
        assertThat(PromptSimilarity.jaccard("sunset over the ocean", "sunset over the calm ocean")).isEqualTo(0.8);
        assertThat(PromptSimilarity.jaccard("cat", "dog")).isZero();
    }

    @Test
    void emptyInputs() {
        assertThat(PromptSimilarity.jaccard("", "  ")).isEqualTo(1.0);
        assertThat(PromptSimilarity.jaccard(null, "cat")).isZero();
        assertThat(PromptSimilarity.tokens("...")).isEmpty();
    }
}
