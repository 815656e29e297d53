package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.config.DeepResearchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a topic is too vague to research and, if so, what to ask.
 *
 * A topic needs clarification when it is blank or shorter than the configured minimum,
 * contains a vague word such as "it" or "something", or is a bare abbreviation like "ml".
 */
@Component
@RequiredArgsConstructor
public class Clarifier {

    private static final Set<String> AMBIGUOUS_TERMS = Set.of(
            "it", "this", "that", "they", "them",
            "something", "anything", "what", "how");

    private static final Set<String> SHORT_TOPICS = Set.of(
            "ai", "ml", "dl", "llm", "nlp",
            "cv", "ag", "ar", "vr", "mr",
            "web", "app", "db", "os", "api");

    private final DeepResearchProperties properties;

    public boolean needsClarification(String topic) {
        if (topic == null || topic.strip().length() < properties.getClarification().getMinTopicLength()) {
            return true;
        }
        String normalized = topic.strip().toLowerCase(Locale.ROOT);
        return containsAmbiguousTerm(normalized) || SHORT_TOPICS.contains(normalized);
    }

    public List<String> generateQuestions(String topic) {
        int max = properties.getClarification().getMaxQuestions();
        List<String> questions = new ArrayList<>();

        if (topic == null || topic.strip().length() < 5) {
            questions.add("What specific topic would you like to research?");
            questions.add("What aspect or angle are you interested in?");
            questions.add("What is the purpose of this research?");
            return questions.subList(0, Math.min(max, questions.size()));
        }

        String normalized = topic.strip().toLowerCase(Locale.ROOT);
        if (normalized.length() < properties.getClarification().getMinTopicLength()) {
            questions.add("Could you provide more context about '" + topic.strip()
                    + "'? What specifically would you like to learn?");
        }
        if (containsAmbiguousTerm(normalized)) {
            questions.add("Your topic seems vague. Could you be more specific about what you mean?");
        }
        questions.add("What depth of research do you need? (brief overview / comprehensive analysis)");

        return questions.subList(0, Math.min(max, questions.size()));
    }

    private static boolean containsAmbiguousTerm(String normalized) {
        return Arrays.stream(normalized.split("\\s+")).anyMatch(AMBIGUOUS_TERMS::contains);
    }
}
