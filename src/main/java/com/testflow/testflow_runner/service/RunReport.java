package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.model.run.RunStatus;

import java.time.Instant;
import java.util.List;

public record RunReport(String runId,
                        String scriptPath,
                        RunStatus status,
                        String runDirectory,
                        String csvFile,
                        String logFile,
                        int rows,
                        long steps,
                        long expectedSteps,
                        List<String> warnings,
                        String error,
                        Instant startedAt,
                        Instant completedAt) {
}
