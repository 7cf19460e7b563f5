package io.mathspeech.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.mathspeech.core.model.AudienceLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class PostProcessorTest {

    private final PostProcessor processor = new PostProcessor();

    @Test
    void collapsesWhitespaceAndCapitalizes() {
        assertThat(processor.process("  x   plus \t y ", AudienceLevel.UNDERGRADUATE)).isEqualTo("X plus y");
    }

    @Test
    void removesSpaceBeforePunctuation() {
        assertThat(processor.process("a , b ; c .", AudienceLevel.UNDERGRADUATE)).isEqualTo("A, b; c.");
    }

    @Test
    void basicAudienceGetsPlainerPhrases() {
        String out = processor.process(
                "x implies y if and only if the set such that z", AudienceLevel.HIGH_SCHOOL);

        assertThat(out).isEqualTo("X means y exactly when the set where z");
    }

    @Test
    void advancedAudienceGetsPreciseTerms() {
        assertThat(processor.process("u dot v over natural log x", AudienceLevel.RESEARCH))
                .isEqualTo("U inner product v over natural logarithm x");
    }

    @Test
    void middleAudienceIsLeftAlone() {
        assertThat(processor.process("u dot v implies w", AudienceLevel.UNDERGRADUATE))
                .isEqualTo("U dot v implies w");
    }

    @Test
    void emptyTextStaysEmpty() {
        assertThat(processor.process("   ", AudienceLevel.ELEMENTARY)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(AudienceLevel.class)
    void idempotentForEveryAudience(AudienceLevel audience) {
        String once = processor.process("u dot dot v , natural log x with respect to y", audience);

        assertThat(processor.process(once, audience)).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1 over 2", "Already capitalized", "ß is lower"})
    void capitalizationOnlyTouchesLowerCaseLetters(String text) {
        String out = processor.process(text, AudienceLevel.UNDERGRADUATE);

        assertThat(out.substring(1)).isEqualTo(text.substring(1));
    }
}
