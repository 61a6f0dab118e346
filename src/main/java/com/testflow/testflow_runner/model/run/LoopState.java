package com.testflow.testflow_runner.model.run;

import lombok.Data;

/**
 * Per-loop iteration counter, keyed by loop id in {@link RunContext#getLoopStates()} so nested
 * loops do not interfere. {@code iteration == 0} means the loop is not active.
 */
@Data
public class LoopState {
    private final int loopId;
    private final int iterations;
    private int iteration = 0;

    public boolean isActive() {
        return iteration > 0;
    }

    public boolean isExhausted() {
        return iteration > iterations;
    }

    public void reset() {
        iteration = 0;
    }
}
