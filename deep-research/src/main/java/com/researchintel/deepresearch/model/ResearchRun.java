package com.researchintel.deepresearch.model;

import com.researchintel.deepresearch.citation.CitationRegistry;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one end-to-end pipeline execution for a topic.
 * Mutated only by the orchestrating thread, once per stage, in stage order.
 */
@Data
@Builder
public class ResearchRun {

    private String runId;
    private String topic;
    private Stage stage;            // null before intake starts
    private RunStatus status;
    private int workers;
    private Depth depth;
    private int budget;
    private String lang;
    private boolean resumed;
    private Plan plan;
    private ClarificationRecord clarification;

    @Builder.Default
    private List<HarvestedSource> sources = new ArrayList<>();
    @Builder.Default
    private List<FetchedDocument> documents = new ArrayList<>();
    @Builder.Default
    private List<ExtractedRecord> records = new ArrayList<>();
    @Builder.Default
    private List<Paragraph> paragraphs = new ArrayList<>();

    private CitationRegistry citations;
    private VerificationVerdict verdict;

    private boolean fetchedFromCache;
    private int fetchTasksDispatched;
    private Instant startedAt;
    private Instant completedAt;
}
