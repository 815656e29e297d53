package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.model.Stage;
import lombok.Getter;

/**
 * A stage raised an exception or reported failure. The run stops at that stage; nothing is retried.
 */
@Getter
public class StageFault extends RuntimeException {

    private final Stage stage;
    private final String runId;

    public StageFault(Stage stage, String runId, String reason) {
        super("Stage " + stage.id() + " failed for run " + runId + ": " + reason);
        this.stage = stage;
        this.runId = runId;
    }

    public StageFault(Stage stage, String runId, Throwable cause) {
        super("Stage " + stage.id() + " failed for run " + runId + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.runId = runId;
    }
}
