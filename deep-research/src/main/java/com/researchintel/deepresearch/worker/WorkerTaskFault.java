package com.researchintel.deepresearch.worker;

import lombok.Getter;

/**
 * A single worker task failed. Carries the input position and item so the caller can log
 * which piece of work broke.
 */
@Getter
public class WorkerTaskFault extends RuntimeException {

    private final int index;
    private final transient Object item;

    public WorkerTaskFault(int index, Object item, Throwable cause) {
        super("Worker task " + index + " failed for item " + item + ": " + cause.getMessage(), cause);
        this.index = index;
        this.item = item;
    }
}
