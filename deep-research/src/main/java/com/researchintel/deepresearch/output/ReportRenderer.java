package com.researchintel.deepresearch.output;

import com.researchintel.deepresearch.config.DeepResearchProperties;
import com.researchintel.deepresearch.model.Paragraph;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders paragraphs into the markdown report.
 *
 * Each paragraph is followed by its citation group, e.g. {@code Text (C001, C002)}, and separated
 * from the next by a blank line. A paragraph with no citation ids is rendered bare so the verifier
 * reports it.
 *
 * Paragraph text is escaped so it cannot pass as something it is not: a leading {@code #} would make
 * it a heading, and an uncited paragraph whose text already ends in a group like {@code (C001)}
 * would look cited.
 */
@Component
@RequiredArgsConstructor
public class ReportRenderer {

    private static final String HEADING_MARKER = "#";

    private final DeepResearchProperties properties;

    public String render(String topic, List<Paragraph> paragraphs) {
        StringBuilder report = new StringBuilder()
                .append("# ").append(properties.getReport().getTitle());
        if (topic != null && !topic.isBlank()) {
            report.append(": ").append(singleLine(topic));
        }
        report.append("\n\n");

        for (Paragraph paragraph : paragraphs) {
            report.append(renderParagraph(paragraph)).append("\n\n");
        }
        return report.toString();
    }

    public String renderParagraph(Paragraph paragraph) {
        String text = singleLine(paragraph.text());
        if (text.startsWith(HEADING_MARKER)) {
            text = "\\" + text;
        }
        if (paragraph.citeIds().isEmpty()) {
            return text.endsWith(")") ? text.substring(0, text.length() - 1) + "\\)" : text;
        }
        return text + " (" + String.join(", ", paragraph.citeIds()) + ")";
    }

    private static String singleLine(String text) {
        return text == null ? "" : text.strip().replaceAll("\\s+", " ");
    }
}
