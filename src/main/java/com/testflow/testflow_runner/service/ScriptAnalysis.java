package com.testflow.testflow_runner.service;

import java.util.List;
import java.util.Map;

public record ScriptAnalysis(String script,
                             int windowStart,
                             int windowEnd,
                             List<NodeSummary> nodes,
                             List<LoopSummary> loops,
                             Map<String, List<Double>> variables,
                             List<String> workflows,
                             List<String> warnings,
                             long expectedSteps,
                             long estimatedDelayMs,
                             String estimatedDelay,
                             List<String> resultHeader) {

    public record NodeSummary(int id, String kind, int startLine, Integer endLine, String type, String instrument) {
    }

    public record LoopSummary(int id, int iterations, int startLine, int endLine) {
    }
}
