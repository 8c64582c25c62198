package fr.lapetina.lex.core.domain.routing;

import fr.lapetina.lex.core.domain.model.QueryComplexity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ComplexityClassifierTest {

    private final ComplexityClassifier classifier = ComplexityClassifier.withDefaults();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "What is Java?|SIMPLE",
            "How to write a function that sorts a list|MODERATE",
            "Design a caching strategy and evaluate the plan|COMPLEX",
            "Write a poem and imagine a story|CREATIVE"
    })
    @DisplayName("should pick the highest-scoring class")
    void shouldPickHighestScore(String prompt, QueryComplexity expected) {
        assertThat(classifier.classify(prompt)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should default to SIMPLE when nothing matches")
    void shouldDefaultToSimple() {
        assertThat(classifier.classify("Good morning")).isEqualTo(QueryComplexity.SIMPLE);
        assertThat(classifier.classify("")).isEqualTo(QueryComplexity.SIMPLE);
        assertThat(classifier.classify(null)).isEqualTo(QueryComplexity.SIMPLE);
    }

    @Test
    @DisplayName("should break ties toward the more demanding class")
    void shouldBreakTiesUpward() {
        // one MODERATE keyword, one COMPLEX keyword
        assertThat(classifier.classify("analyze this and design that")).isEqualTo(QueryComplexity.COMPLEX);
    }

    @Test
    @DisplayName("should only count whole words")
    void shouldRespectWordBoundaries() {
        assertThat(classifier.score("acknowledge the knowledge"))
                .containsEntry(QueryComplexity.SIMPLE, 0);
    }

    @Test
    @DisplayName("should count repeated keywords")
    void shouldCountRepeats() {
        assertThat(classifier.score("code, more code, and code again"))
                .containsEntry(QueryComplexity.MODERATE, 3);
    }

    @Test
    @DisplayName("should match case-insensitively")
    void shouldIgnoreCase() {
        assertThat(classifier.classify("COMPOSE A POEM")).isEqualTo(QueryComplexity.CREATIVE);
    }
}
