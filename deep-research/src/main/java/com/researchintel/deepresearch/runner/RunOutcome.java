package com.researchintel.deepresearch.runner;

/**
 * Process exit status of a research invocation.
 */
public enum RunOutcome {
    SUCCESS(0),
    HARD_ERROR(1),
    CLARIFICATION_NEEDED(2),
    VERIFICATION_FAILED(3);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
