package com.researchintel.deepresearch.runner;

import com.researchintel.deepresearch.model.ClarificationRecord;
import com.researchintel.deepresearch.model.Depth;
import com.researchintel.deepresearch.model.ResearchRun;
import com.researchintel.deepresearch.model.RunOverrides;
import com.researchintel.deepresearch.model.RunStatus;
import com.researchintel.deepresearch.model.VerificationVerdict;
import com.researchintel.deepresearch.service.Clarifier;
import com.researchintel.deepresearch.service.ResearchPipelineService;
import com.researchintel.deepresearch.service.StageFault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command-line entry point.
 *
 *   deep-research "topic words" [--run-id=ID] [--workers=N] [--depth=brief|medium|deep]
 *                 [--budget=N] [--lang=en] [--answer=TEXT ...]
 *   deep-research --verify-only --run-id=ID
 *
 * Exit status: 0 success, 1 hard error, 2 clarification needed, 3 verification failed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "deep-research.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ResearchRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ResearchPipelineService pipelineService;
    private final Clarifier clarifier;

    private RunOutcome outcome = RunOutcome.SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        outcome = execute(args);
        log.info("Finished with outcome {} (exit {})", outcome, outcome.exitCode());
    }

    @Override
    public int getExitCode() {
        return outcome.exitCode();
    }

    public RunOutcome getOutcome() {
        return outcome;
    }

    RunOutcome execute(ApplicationArguments args) {
        try {
            if (args.containsOption("verify-only")) {
                return verifyOnly(option(args, "run-id"));
            }
            return research(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return RunOutcome.HARD_ERROR;
        } catch (StageFault e) {
            log.error("Research run {} aborted at stage {}: {}", e.getRunId(), e.getStage().id(), e.getMessage());
            return RunOutcome.HARD_ERROR;
        } catch (RuntimeException e) {
            log.error("Research run failed: {}", e.getMessage(), e);
            return RunOutcome.HARD_ERROR;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RunOutcome verifyOnly(String runId) {
        if (runId == null) {
            log.error("--verify-only requires --run-id");
            return RunOutcome.HARD_ERROR;
        }
        VerificationVerdict verdict;
        try {
            verdict = pipelineService.reverify(runId);
        } catch (IllegalStateException e) {
            log.error("Cannot verify {}: {}", runId, e.getMessage());
            return RunOutcome.HARD_ERROR;
        }
        log.info("Verification result for {}: {} (paragraph_without_citation_count={}, "
                        + "paragraphs_jsonl_cite_ids_passed={}, paragraph_end_citation_passed={})",
                runId, verdict.isPassed() ? "PASSED" : "FAILED", verdict.getParagraphWithoutCitationCount(),
                verdict.isParagraphLogPassed(), verdict.isReportPassed());
        return verdict.isPassed() ? RunOutcome.SUCCESS : RunOutcome.VERIFICATION_FAILED;
    }

    private RunOutcome research(ApplicationArguments args) {
        String topic = String.join(" ", args.getNonOptionArgs()).strip();
        String runId = option(args, "run-id");
        if (runId == null) {
            runId = pipelineService.generateRunId(topic);
        }

        ClarificationRecord clarification = null;
        if (clarifier.needsClarification(topic)) {
            List<String> questions = clarifier.generateQuestions(topic);
            List<String> answers = answers(args);

            if (!args.containsOption("answer")) {
                pipelineService.recordClarification(runId, ClarificationRecord.builder()
                        .status(ClarificationRecord.Status.PENDING)
                        .originalTopic(topic)
                        .questions(questions)
                        .build());
                log.warn("Clarification required for topic '{}' (run {}). Please answer:", topic, runId);
                for (int i = 0; i < questions.size(); i++) {
                    log.warn("  {}. {}", i + 1, questions.get(i));
                }
                return RunOutcome.CLARIFICATION_NEEDED;
            }

            if (answers.isEmpty()) {
                pipelineService.recordClarification(runId, ClarificationRecord.builder()
                        .status(ClarificationRecord.Status.FAILED)
                        .originalTopic(topic)
                        .questions(questions)
                        .failureReason("No clarification provided")
                        .build());
                log.error("No clarification provided for topic '{}'", topic);
                return RunOutcome.HARD_ERROR;
            }

            clarification = ClarificationRecord.builder()
                    .status(ClarificationRecord.Status.CLARIFIED)
                    .originalTopic(topic)
                    .questions(questions)
                    .answers(answers)
                    .build();
            topic = String.join(" ", answers);
            log.info("Clarified topic: {}", topic);
        }

        RunOverrides overrides = RunOverrides.builder()
                .runId(runId)
                .workers(intOption(args, "workers"))
                .depth(option(args, "depth") == null ? null : Depth.parse(option(args, "depth")))
                .budget(intOption(args, "budget"))
                .lang(option(args, "lang"))
                .clarification(clarification)
                .build();

        ResearchRun run = pipelineService.runPipeline(topic, overrides);
        if (run.getStatus() == RunStatus.VERIFICATION_FAILED) {
            log.warn("Verification FAILED for run {}", run.getRunId());
            return RunOutcome.VERIFICATION_FAILED;
        }
        log.info("Research complete. Run ID: {}", run.getRunId());
        return RunOutcome.SUCCESS;
    }

    private static List<String> answers(ApplicationArguments args) {
        List<String> values = args.getOptionValues("answer");
        if (values == null) return List.of();
        return values.stream().map(String::strip).filter(a -> !a.isEmpty()).toList();
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.get(values.size() - 1).strip();
        return value.isEmpty() ? null : value;
    }

    private static Integer intOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null) return null;
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got '" + value + "'");
        }
    }
}
