package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.model.Depth;
import com.researchintel.deepresearch.model.ExtractedRecord;
import com.researchintel.deepresearch.model.FetchedDocument;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sentence-level extraction: the leading sentences of a document become its key points
 * (how many depends on depth) and the first one doubles as the supporting quote.
 */
@Component
public class KeyPointExtractor {

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    public ExtractedRecord extract(FetchedDocument document, Depth depth) {
        List<String> sentences = sentences(document.content());

        List<String> keyPoints = sentences.subList(0, Math.min(depth.keyPointsPerRecord(), sentences.size()));
        List<String> quotes = sentences.isEmpty() ? List.of() : List.of(sentences.get(0));

        return new ExtractedRecord(document.url(), document.title(), null, List.copyOf(keyPoints), quotes);
    }

    private static List<String> sentences(String content) {
        if (content == null || content.isBlank()) return List.of();
        return Arrays.stream(SENTENCE_END.split(content.strip()))
                .map(s -> s.strip().replaceAll("\\s+", " "))
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
