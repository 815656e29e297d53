package com.researchintel.deepresearch.model;

public enum RunStatus {
    RUNNING, COMPLETED, VERIFICATION_FAILED, FAILED
}
