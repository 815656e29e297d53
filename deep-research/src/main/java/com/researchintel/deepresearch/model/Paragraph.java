package com.researchintel.deepresearch.model;

import java.util.List;

/**
 * A unit of report text and the citation ids backing it. Serialized one per line
 * into {@code drafts/paragraphs.jsonl} as {@code {"text": ..., "citeIds": [...]}}.
 */
public record Paragraph(String text, List<String> citeIds) {

    public Paragraph {
        citeIds = citeIds == null ? List.of() : List.copyOf(citeIds);
    }
}
