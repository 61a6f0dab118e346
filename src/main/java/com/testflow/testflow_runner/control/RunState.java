package com.testflow.testflow_runner.control;

/**
 * Externally mutable run-state token polled by the engine. Last write wins; an absent token
 * reads as {@link RunSignal#RUNNING}.
 */
public interface RunState {

    RunSignal poll();

    void signal(RunSignal signal);

    /**
     * Writes {@code replacement} only while the token still reads {@code expected}, so a signal
     * written in between (a stop right after a resume) is never overwritten.
     *
     * @return true when the token was replaced
     */
    boolean compareAndSignal(RunSignal expected, RunSignal replacement);

    /** Removes the token once the run is over. */
    void clear();
}
