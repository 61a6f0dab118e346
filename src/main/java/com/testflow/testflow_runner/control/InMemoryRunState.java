package com.testflow.testflow_runner.control;

import java.util.concurrent.atomic.AtomicReference;

public class InMemoryRunState implements RunState {

    private final AtomicReference<RunSignal> signal = new AtomicReference<>(RunSignal.RUNNING);

    @Override
    public RunSignal poll() {
        return signal.get();
    }

    @Override
    public void signal(RunSignal value) {
        signal.set(value);
    }

    @Override
    public boolean compareAndSignal(RunSignal expected, RunSignal replacement) {
        return signal.compareAndSet(expected, replacement);
    }

    @Override
    public void clear() {
        signal.set(RunSignal.RUNNING);
    }
}
