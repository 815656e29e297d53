package com.researchintel.deepresearch.runner;

import com.researchintel.deepresearch.config.DeepResearchProperties;
import com.researchintel.deepresearch.model.ClarificationRecord;
import com.researchintel.deepresearch.model.Depth;
import com.researchintel.deepresearch.model.ResearchRun;
import com.researchintel.deepresearch.model.RunOverrides;
import com.researchintel.deepresearch.model.RunStatus;
import com.researchintel.deepresearch.model.Stage;
import com.researchintel.deepresearch.model.VerificationVerdict;
import com.researchintel.deepresearch.service.Clarifier;
import com.researchintel.deepresearch.service.ResearchPipelineService;
import com.researchintel.deepresearch.service.StageFault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchRunnerTest {

    private static final String TOPIC = "quantum error correction codes";

    @Mock
    private ResearchPipelineService pipelineService;

    private ResearchRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ResearchRunner(pipelineService, new Clarifier(new DeepResearchProperties()));
    }

    private RunOutcome execute(String... args) {
        return runner.execute(new DefaultApplicationArguments(args));
    }

    private static ResearchRun run(RunStatus status) {
        return ResearchRun.builder().runId("r1").status(status).build();
    }

    private static VerificationVerdict verdict(boolean passed) {
        return VerificationVerdict.builder()
                .paragraphsWithoutCitation(passed ? List.of() : List.of(1))
                .issues(List.of())
                .paragraphLogErrors(List.of())
                .reportPassed(passed)
                .paragraphLogPassed(true)
                .passed(passed)
                .build();
    }

    @Nested
    @DisplayName("Research runs")
    class Research {

        @Test
        @DisplayName("a completed run exits 0 and passes the parsed options through")
        void success() {
            when(pipelineService.runPipeline(eq(TOPIC), any())).thenReturn(run(RunStatus.COMPLETED));

            RunOutcome outcome = execute("quantum", "error", "correction", "codes",
                    "--run-id=r1", "--workers=3", "--depth=deep", "--budget=4", "--lang=de");

            assertThat(outcome).isEqualTo(RunOutcome.SUCCESS);
            assertThat(outcome.exitCode()).isZero();

            ArgumentCaptor<RunOverrides> captor = ArgumentCaptor.forClass(RunOverrides.class);
            verify(pipelineService).runPipeline(eq(TOPIC), captor.capture());
            RunOverrides overrides = captor.getValue();
            assertThat(overrides.getRunId()).isEqualTo("r1");
            assertThat(overrides.getWorkers()).isEqualTo(3);
            assertThat(overrides.getDepth()).isEqualTo(Depth.DEEP);
            assertThat(overrides.getBudget()).isEqualTo(4);
            assertThat(overrides.getLang()).isEqualTo("de");
            assertThat(overrides.getClarification()).isNull();
        }

        @Test
        @DisplayName("a failed audit exits 3")
        void verificationFailed() {
            when(pipelineService.runPipeline(eq(TOPIC), any())).thenReturn(run(RunStatus.VERIFICATION_FAILED));

            assertThat(execute(TOPIC, "--run-id=r1").exitCode()).isEqualTo(3);
        }

        @Test
        @DisplayName("a stage fault exits 1")
        void stageFault() {
            when(pipelineService.runPipeline(eq(TOPIC), any()))
                    .thenThrow(new StageFault(Stage.FETCH, "r1", "connection reset"));

            assertThat(execute(TOPIC, "--run-id=r1")).isEqualTo(RunOutcome.HARD_ERROR);
        }

        @Test
        @DisplayName("malformed numeric or depth options exit 1 without running")
        void badOptions() {
            assertThat(execute(TOPIC, "--run-id=r1", "--workers=many")).isEqualTo(RunOutcome.HARD_ERROR);
            assertThat(execute(TOPIC, "--run-id=r1", "--depth=bottomless")).isEqualTo(RunOutcome.HARD_ERROR);
            verify(pipelineService, never()).runPipeline(anyString(), any());
        }
    }

    @Nested
    @DisplayName("Clarification")
    class Clarification {

        @Test
        @DisplayName("a vague topic without answers records a pending clarification and exits 2")
        void pending() {
            when(pipelineService.generateRunId("ml")).thenReturn("ml_20260314_092653");

            RunOutcome outcome = execute("ml");

            assertThat(outcome).isEqualTo(RunOutcome.CLARIFICATION_NEEDED);
            assertThat(outcome.exitCode()).isEqualTo(2);

            ArgumentCaptor<ClarificationRecord> captor = ArgumentCaptor.forClass(ClarificationRecord.class);
            verify(pipelineService).recordClarification(eq("ml_20260314_092653"), captor.capture());
            assertThat(captor.getValue().getStatus()).isEqualTo(ClarificationRecord.Status.PENDING);
            assertThat(captor.getValue().getQuestions()).isNotEmpty();
            verify(pipelineService, never()).runPipeline(anyString(), any());
        }

        @Test
        @DisplayName("blank answers record a failed clarification and exit 1")
        void blankAnswers() {
            RunOutcome outcome = execute("ml", "--run-id=r1", "--answer=   ");

            assertThat(outcome).isEqualTo(RunOutcome.HARD_ERROR);
            ArgumentCaptor<ClarificationRecord> captor = ArgumentCaptor.forClass(ClarificationRecord.class);
            verify(pipelineService).recordClarification(eq("r1"), captor.capture());
            assertThat(captor.getValue().getStatus()).isEqualTo(ClarificationRecord.Status.FAILED);
            assertThat(captor.getValue().getFailureReason()).isNotBlank();
        }

        @Test
        @DisplayName("answers replace the topic and travel with the run")
        void answered() {
            when(pipelineService.runPipeline(anyString(), any())).thenReturn(run(RunStatus.COMPLETED));

            RunOutcome outcome = execute("ml", "--run-id=r1",
                    "--answer=machine learning for protein folding", "--answer=recent benchmarks");

            assertThat(outcome).isEqualTo(RunOutcome.SUCCESS);
            ArgumentCaptor<RunOverrides> captor = ArgumentCaptor.forClass(RunOverrides.class);
            verify(pipelineService).runPipeline(
                    eq("machine learning for protein folding recent benchmarks"), captor.capture());
            ClarificationRecord clarification = captor.getValue().getClarification();
            assertThat(clarification.getStatus()).isEqualTo(ClarificationRecord.Status.CLARIFIED);
            assertThat(clarification.getOriginalTopic()).isEqualTo("ml");
            assertThat(clarification.getAnswers()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Verify-only")
    class VerifyOnly {

        @Test
        @DisplayName("requires a run id")
        void requiresRunId() {
            assertThat(execute("--verify-only")).isEqualTo(RunOutcome.HARD_ERROR);
        }

        @Test
        @DisplayName("exits 0 when the artifacts pass")
        void passes() {
            when(pipelineService.reverify("r1")).thenReturn(verdict(true));

            assertThat(execute("--verify-only", "--run-id=r1")).isEqualTo(RunOutcome.SUCCESS);
            verify(pipelineService, never()).runPipeline(anyString(), any());
        }

        @Test
        @DisplayName("exits 3 when the artifacts fail")
        void fails() {
            when(pipelineService.reverify("r1")).thenReturn(verdict(false));

            assertThat(execute("--verify-only", "--run-id=r1")).isEqualTo(RunOutcome.VERIFICATION_FAILED);
        }

        @Test
        @DisplayName("exits 1 when the report is missing")
        void missingReport() {
            when(pipelineService.reverify("r1")).thenThrow(new IllegalStateException("report.md not found"));

            assertThat(execute("--verify-only", "--run-id=r1")).isEqualTo(RunOutcome.HARD_ERROR);
        }
    }
}
