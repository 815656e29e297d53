package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.cache.FetchCache;
import com.researchintel.deepresearch.citation.CitationRegistry;
import com.researchintel.deepresearch.config.DeepResearchProperties;
import com.researchintel.deepresearch.model.Citation;
import com.researchintel.deepresearch.model.ClarificationRecord;
import com.researchintel.deepresearch.model.Depth;
import com.researchintel.deepresearch.model.ExtractedRecord;
import com.researchintel.deepresearch.model.FetchedDocument;
import com.researchintel.deepresearch.model.HarvestedSource;
import com.researchintel.deepresearch.model.Paragraph;
import com.researchintel.deepresearch.model.ParagraphLogCheck;
import com.researchintel.deepresearch.model.Plan;
import com.researchintel.deepresearch.model.PlanRecord;
import com.researchintel.deepresearch.model.ResearchRun;
import com.researchintel.deepresearch.model.RunOverrides;
import com.researchintel.deepresearch.model.RunStatus;
import com.researchintel.deepresearch.model.Stage;
import com.researchintel.deepresearch.model.StageLogEntry;
import com.researchintel.deepresearch.model.StageStatus;
import com.researchintel.deepresearch.model.VerificationVerdict;
import com.researchintel.deepresearch.output.ReportRenderer;
import com.researchintel.deepresearch.output.RunArtifactStore;
import com.researchintel.deepresearch.verify.Verifier;
import com.researchintel.deepresearch.worker.WorkerPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a research run through the fixed stage sequence
 * intake → plan → harvest → fetch → extract → verify → write → audit → cache.
 *
 * Stages run one at a time on the calling thread. A stage that throws or returns false stops the run.
 * A failed audit is not an exception: the run comes back with status VERIFICATION_FAILED and every
 * artifact written so far stays on disk. Any other failure is raised as a {@link StageFault}.
 *
 * An existing run directory is a resume: parameters are reloaded from the persisted plan and
 * clarification records and the whole sequence runs again from intake. Fetch results come from
 * the cache when present.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResearchPipelineService {

    private static final DateTimeFormatter RUN_ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final List<String> SOURCE_CATEGORIES = List.of("web", "academic");
    private static final int SOURCES_PER_BUDGET_UNIT = 5;

    private final DeepResearchProperties properties;
    private final RunArtifactStore artifactStore;
    private final FetchCache fetchCache;
    private final SourceHarvester sourceHarvester;
    private final ContentFetcher contentFetcher;
    private final KeyPointExtractor keyPointExtractor;
    private final Verifier verifier;
    private final ReportRenderer reportRenderer;
    private final Clock clock;

    public ResearchRun runPipeline(String topic, RunOverrides overrides) {
        RunOverrides o = overrides == null ? RunOverrides.none() : overrides;
        String runId = o.getRunId() == null || o.getRunId().isBlank() ? generateRunId(topic) : o.getRunId();

        ResearchRun run = artifactStore.exists(runId) ? rehydrate(runId, topic) : newRun(runId, topic);
        applyOverrides(run, o);
        validate(run);

        artifactStore.prepare(runId);
        MDC.put("runId", runId);
        log.info("Starting research run {} (workers={}, depth={}, budget={}, lang={}, resumed={})",
                runId, run.getWorkers(), run.getDepth().id(), run.getBudget(), run.getLang(), run.isResumed());

        try (WorkerPool pool = new WorkerPool(run.getWorkers())) {
            for (Stage stage : Stage.pipeline()) {
                if (runStage(run, stage, pool)) {
                    continue;
                }
                run.setCompletedAt(clock.instant());
                if (stage == Stage.AUDIT) {
                    run.setStatus(RunStatus.VERIFICATION_FAILED);
                    log.warn("Run {} stopped at audit: verification failed, artifacts kept in {}",
                            runId, artifactStore.runDir(runId));
                    return run;
                }
                run.setStatus(RunStatus.FAILED);
                throw new StageFault(stage, runId, "stage reported failure");
            }

            run.setStatus(RunStatus.COMPLETED);
            run.setCompletedAt(clock.instant());
            log.info("Research run {} complete: {} paragraphs, {} citations",
                    runId, run.getParagraphs().size(), run.getCitations().size());
            return run;
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * Recompute the audit verdict from the artifacts of an existing run without executing any stage.
     *
     * @throws IllegalStateException if the run has no report
     */
    public VerificationVerdict reverify(String runId) {
        String report = artifactStore.readReport(runId)
                .orElseThrow(() -> new IllegalStateException("report.md not found for run " + runId
                        + " at " + artifactStore.reportPath(runId)));
        List<String> paragraphLog = artifactStore.readParagraphLog(runId).orElse(List.of());

        VerificationVerdict verdict = verifier.verifyArtifacts(report, paragraphLog);
        log.info("Re-verification of {}: {}", runId, verdict.isPassed() ? "PASSED" : "FAILED");
        return verdict;
    }

    public String generateRunId(String topic) {
        String safeTopic = topic == null ? "" : topic.chars()
                .limit(20)
                .filter(c -> Character.isLetterOrDigit(c) && c < 128 || c == '_' || c == '-')
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                .toString();
        String timestamp = RUN_ID_TIMESTAMP.format(clock.instant().atZone(clock.getZone()));
        return (safeTopic.isEmpty() ? "no_topic" : safeTopic) + "_" + timestamp;
    }

    /**
     * Persist a clarification record ahead of a run, e.g. a pending one when the caller must stop and ask.
     */
    public void recordClarification(String runId, ClarificationRecord record) {
        artifactStore.writeClarification(runId, record);
    }

    // ── Stage dispatch ───────────────────────────────────────────────────────

    private boolean runStage(ResearchRun run, Stage stage, WorkerPool pool) {
        run.setStage(stage);
        try {
            appendStageLog(run, stage, StageStatus.STARTED, Map.of());
            log.info("Stage {} started", stage.id());

            boolean succeeded = switch (stage) {
                case INTAKE -> intake(run);
                case PLAN -> plan(run);
                case HARVEST -> harvest(run);
                case FETCH -> fetch(run, pool);
                case EXTRACT -> extract(run);
                case VERIFY -> verify(run);
                case WRITE -> write(run);
                case AUDIT -> audit(run);
                case CACHE -> cache(run);
            };

            Map<String, Object> details = stageDetails(run, stage);
            details.put("success", succeeded);
            if (succeeded) {
                appendStageLog(run, stage, StageStatus.COMPLETED, details);
                log.info("Stage {} completed", stage.id());
            } else {
                appendStageLog(run, stage, StageStatus.FAILED, details);
                log.warn("Stage {} reported failure", stage.id());
            }
            return succeeded;
        } catch (RuntimeException e) {
            log.error("Stage {} failed: {}", stage.id(), e.getMessage(), e);
            run.setStatus(RunStatus.FAILED);
            run.setCompletedAt(clock.instant());
            recordFailure(run, stage, e);
            throw new StageFault(stage, run.getRunId(), e);
        }
    }

    private void recordFailure(ResearchRun run, Stage stage, RuntimeException cause) {
        try {
            appendStageLog(run, stage, StageStatus.FAILED, Map.of("error", String.valueOf(cause.getMessage())));
        } catch (UncheckedIOException e) {
            cause.addSuppressed(e);
            log.error("Could not record failure of stage {} in the stage log: {}", stage.id(), e.getMessage());
        }
    }

    private Map<String, Object> stageDetails(ResearchRun run, Stage stage) {
        Map<String, Object> details = new LinkedHashMap<>();
        switch (stage) {
            case INTAKE -> details.put("clarification", run.getClarification() != null);
            case PLAN -> details.put("estimatedSourceCount", run.getPlan().estimatedSourceCount());
            case HARVEST -> details.put("sources", run.getSources().size());
            case FETCH -> {
                details.put("documents", run.getDocuments().size());
                details.put("fromCache", run.isFetchedFromCache());
                details.put("tasksDispatched", run.getFetchTasksDispatched());
            }
            case EXTRACT -> details.put("citations", run.getCitations().size());
            case VERIFY, WRITE -> details.put("paragraphs", run.getParagraphs().size());
            case AUDIT -> {
                details.put("passed", run.getVerdict().isPassed());
                details.put("paragraphWithoutCitationCount", run.getVerdict().getParagraphWithoutCitationCount());
            }
            case CACHE -> details.put("cached", fetchCache.has(run.getRunId()));
        }
        return details;
    }

    // ── Stages ───────────────────────────────────────────────────────────────

    private boolean intake(ResearchRun run) {
        if (run.getTopic() == null || run.getTopic().isBlank()) {
            log.warn("No topic supplied for run {}", run.getRunId());
            return false;
        }
        if (run.getClarification() != null) {
            artifactStore.writeClarification(run.getRunId(), run.getClarification());
        }
        return true;
    }

    private boolean plan(ResearchRun run) {
        Plan plan = new Plan(
                queriesFor(run.getTopic(), run.getDepth()),
                SOURCE_CATEGORIES,
                run.getBudget() * SOURCES_PER_BUDGET_UNIT,
                run.getDepth());
        run.setPlan(plan);
        artifactStore.writePlanRecord(run.getRunId(),
                new PlanRecord(run.getWorkers(), run.getDepth(), run.getBudget(), run.getLang(), plan));
        return true;
    }

    private boolean harvest(ResearchRun run) {
        List<HarvestedSource> harvested = sourceHarvester.harvest(run.getTopic(), run.getPlan(), run.getBudget());
        if (harvested.size() < run.getBudget()) {
            log.warn("Harvest produced {} sources, budget is {}", harvested.size(), run.getBudget());
            return false;
        }
        run.setSources(new ArrayList<>(harvested.subList(0, run.getBudget())));
        log.info("Harvested {} sources", run.getSources().size());
        return true;
    }

    private boolean fetch(ResearchRun run, WorkerPool pool) {
        Optional<List<FetchedDocument>> cached = fetchCache.load(run.getRunId());
        if (cached.isPresent()) {
            run.setDocuments(new ArrayList<>(cached.get()));
            run.setFetchedFromCache(true);
            run.setFetchTasksDispatched(0);
            log.info("Using {} cached documents, skipping fetch", cached.get().size());
            return true;
        }

        List<FetchedDocument> documents = pool.run(contentFetcher::fetch, run.getSources());
        run.setDocuments(new ArrayList<>(documents));
        run.setFetchedFromCache(false);
        run.setFetchTasksDispatched(run.getSources().size());
        fetchCache.save(run.getRunId(), documents);
        return true;
    }

    private boolean extract(ResearchRun run) {
        CitationRegistry registry = run.getCitations();
        registry.reset();

        List<ExtractedRecord> records = new ArrayList<>(run.getDocuments().size());
        for (FetchedDocument document : run.getDocuments()) {
            ExtractedRecord extracted = keyPointExtractor.extract(document, run.getDepth());
            String cid = registry.nextId();
            String quote = extracted.quotes().isEmpty() ? null : extracted.quotes().get(0);
            registry.register(cid, document.url(), document.title(), document.url(), quote);
            records.add(extracted.withCitationId(cid));
        }

        run.setRecords(records);
        log.info("Extracted {} records, registered citations {}", records.size(),
                registry.all().stream().map(Citation::cid).toList());
        return true;
    }

    private boolean verify(ResearchRun run) {
        List<Paragraph> paragraphs = new ArrayList<>();
        for (ExtractedRecord record : run.getRecords()) {
            if (record.keyPoints().isEmpty()) continue;
            paragraphs.add(new Paragraph(String.join(" ", record.keyPoints()), List.of(record.citationId())));
        }
        run.setParagraphs(paragraphs);
        artifactStore.writeParagraphLog(run.getRunId(), paragraphs);

        ParagraphLogCheck provisional = verifier.verifyParagraphLog(
                artifactStore.readParagraphLog(run.getRunId()).orElse(List.of()));

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("stage", Stage.VERIFY.id());
        snapshot.put("status", "completed");
        snapshot.put("paragraphsCount", paragraphs.size());
        snapshot.put("paragraphLogPassed", provisional.passed());
        snapshot.put("paragraphLogErrors", provisional.errors());
        artifactStore.writeVerificationSnapshot(run.getRunId(), snapshot);
        return true;
    }

    private boolean write(ResearchRun run) {
        String report = reportRenderer.render(run.getTopic(), run.getParagraphs());
        artifactStore.writeReport(run.getRunId(), report);
        artifactStore.writeCitations(run.getRunId(), run.getCitations().all());
        return true;
    }

    private boolean audit(ResearchRun run) {
        String report = artifactStore.readReport(run.getRunId())
                .orElseThrow(() -> new IllegalStateException("report.md missing at audit"));
        List<String> paragraphLog = artifactStore.readParagraphLog(run.getRunId()).orElse(List.of());

        VerificationVerdict verdict = verifier.verifyArtifacts(report, paragraphLog);
        run.setVerdict(verdict);
        artifactStore.writeVerdict(run.getRunId(), verdict);

        log.info("Audit: passed={}, paragraphs={}, without citation={}, citations found={}",
                verdict.isPassed(), verdict.getTotalParagraphs(),
                verdict.getParagraphWithoutCitationCount(), verdict.getCitationsFound());
        return verdict.isPassed();
    }

    private boolean cache(ResearchRun run) {
        if (!fetchCache.has(run.getRunId())) {
            log.warn("No cache entry found for run {} after fetch", run.getRunId());
        }
        return true;
    }

    // ── Run construction ─────────────────────────────────────────────────────

    private ResearchRun newRun(String runId, String topic) {
        DeepResearchProperties.Defaults defaults = properties.getDefaults();
        return ResearchRun.builder()
                .runId(runId)
                .topic(topic)
                .status(RunStatus.RUNNING)
                .workers(defaults.getWorkers())
                .depth(defaults.getDepth())
                .budget(defaults.getBudget())
                .lang(defaults.getLang())
                .citations(new CitationRegistry(clock))
                .startedAt(clock.instant())
                .build();
    }

    private ResearchRun rehydrate(String runId, String topic) {
        ResearchRun run = newRun(runId, topic);
        run.setResumed(true);

        artifactStore.readPlanRecord(runId).ifPresent(record -> {
            run.setWorkers(record.workers());
            run.setDepth(record.depth());
            run.setBudget(record.budget());
            run.setLang(record.lang());
        });
        artifactStore.readClarification(runId).ifPresent(run::setClarification);

        log.info("Resuming run {} from {}", runId, artifactStore.runDir(runId));
        return run;
    }

    private void applyOverrides(ResearchRun run, RunOverrides o) {
        if (o.getWorkers() != null) run.setWorkers(o.getWorkers());
        if (o.getDepth() != null) run.setDepth(o.getDepth());
        if (o.getBudget() != null) run.setBudget(o.getBudget());
        if (o.getLang() != null && !o.getLang().isBlank()) run.setLang(o.getLang());
        if (o.getClarification() != null) run.setClarification(o.getClarification());
    }

    private void validate(ResearchRun run) {
        if (run.getWorkers() < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + run.getWorkers());
        }
        if (run.getBudget() < 1) {
            throw new IllegalArgumentException("budget must be >= 1, got " + run.getBudget());
        }
        if (run.getDepth() == null) {
            throw new IllegalArgumentException("depth is required");
        }
    }

    private static List<String> queriesFor(String topic, Depth depth) {
        return switch (depth) {
            case BRIEF -> List.of(topic);
            case MEDIUM -> List.of(topic, topic + " review");
            case DEEP -> List.of(topic, topic + " review", topic + " open problems");
        };
    }

    private void appendStageLog(ResearchRun run, Stage stage, StageStatus status, Map<String, Object> details) {
        artifactStore.appendStageLog(new StageLogEntry(clock.instant(), run.getRunId(), stage, status, details));
    }
}
