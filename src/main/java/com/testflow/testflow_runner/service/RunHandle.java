package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.control.RunSignal;
import com.testflow.testflow_runner.control.RunState;
import com.testflow.testflow_runner.model.run.RunLog;
import com.testflow.testflow_runner.model.run.RunStatus;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;

/** A prepared or running script run, as kept by the {@link RunRegistry}. */
@Getter
@RequiredArgsConstructor
public class RunHandle {

    private final String runId;
    private final RunRequest request;
    private final Path runDirectory;
    private final Path csvFile;
    private final Path logFile;
    private final RunState runState;
    private final RunLog runLog;
    private final Instant createdAt;

    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile RunReport report;

    public void signal(RunSignal signal) {
        runState.signal(signal);
    }

    void complete(RunReport report) {
        this.report = report;
        this.status = report.status();
    }
}
