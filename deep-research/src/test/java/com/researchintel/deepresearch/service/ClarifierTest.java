package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.config.DeepResearchProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClarifierTest {

    private final DeepResearchProperties properties = new DeepResearchProperties();
    private final Clarifier clarifier = new Clarifier(properties);

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"ml", "  LLM  ", "quantum codes", "tell me something about batteries"})
    @DisplayName("short, abbreviated or vague topics need clarification")
    void vagueTopics(String topic) {
        assertThat(clarifier.needsClarification(topic)).isTrue();
    }

    @Test
    @DisplayName("a specific topic goes straight through")
    void specificTopic() {
        assertThat(clarifier.needsClarification("quantum error correction codes")).isFalse();
    }

    @Test
    @DisplayName("a missing topic gets the generic questions")
    void genericQuestions() {
        List<String> questions = clarifier.generateQuestions("");

        assertThat(questions).hasSize(3);
        assertThat(questions.get(0)).isEqualTo("What specific topic would you like to research?");
    }

    @Test
    @DisplayName("a short topic is quoted back in the first question")
    void shortTopicQuestion() {
        List<String> questions = clarifier.generateQuestions("solar cells");

        assertThat(questions.get(0)).contains("'solar cells'");
        assertThat(questions).last().asString().contains("depth of research");
    }

    @Test
    @DisplayName("questions are capped at the configured maximum")
    void cappedQuestions() {
        properties.getClarification().setMaxQuestions(1);

        assertThat(clarifier.generateQuestions("what is it")).hasSize(1);
    }

    @Test
    @DisplayName("the minimum topic length is configurable")
    void configurableMinimumLength() {
        properties.getClarification().setMinTopicLength(5);

        assertThat(clarifier.needsClarification("solar cells")).isFalse();
    }
}
