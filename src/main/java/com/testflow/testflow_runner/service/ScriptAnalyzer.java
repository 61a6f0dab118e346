package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.executor.impl.DelayExecutor;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.model.script.VariableDeclaration;
import com.testflow.testflow_runner.parser.ScriptParser;
import com.testflow.testflow_runner.result.ResultSchemaBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parse-only inspection of a script: structure, warnings and a run-time estimate. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptAnalyzer {

    private static final Pattern WAIT = Pattern.compile("wait\\s*\\(\\s*(\\d+(?:\\.\\d+)?)\\s*\\)", Pattern.CASE_INSENSITIVE);

    private final ScriptParser parser;

    public ScriptAnalysis analyze(String scriptPath) {
        if (scriptPath == null || scriptPath.isBlank()) {
            throw new IllegalArgumentException("scriptPath is required");
        }
        Path script = Path.of(scriptPath);
        if (!Files.isRegularFile(script)) {
            throw new IllegalArgumentException("Script not found: " + script.toAbsolutePath());
        }
        return analyze(parser.parse(script));
    }

    public ScriptAnalysis analyze(ScriptGraph graph) {
        List<ScriptAnalysis.NodeSummary> nodes = new ArrayList<>();
        graph.getNodes().values().forEach(node -> nodes.add(new ScriptAnalysis.NodeSummary(
                node.getId(), node.getKind().name(), node.getStartLine(), node.getEndLine(),
                node.getDescriptor().nodeType(), node.getDescriptor().instrumentName())));

        List<ScriptAnalysis.LoopSummary> loops = new ArrayList<>();
        graph.getLoops().values().forEach(loop -> loops.add(new ScriptAnalysis.LoopSummary(
                loop.getId(), loop.getIterations(), loop.getStartLine(), loop.getEndLine())));

        Map<String, List<Double>> variables = new LinkedHashMap<>();
        for (VariableDeclaration declaration : graph.getVariables().values()) {
            variables.putIfAbsent(declaration.name(), declaration.values());
        }

        long delayMs = estimateDelayMs(graph.windowInstructions());
        return new ScriptAnalysis(graph.getName(),
                graph.getWindow().startLine(), graph.getWindow().endLine(),
                nodes, loops, variables,
                List.copyOf(graph.getWorkflows().names()),
                graph.getWarnings().stream().map(ParseWarning::message).toList(),
                graph.getExpectedSteps(),
                delayMs, formatHms(delayMs),
                ResultSchemaBuilder.build(graph).columns());
    }

    /** Sum of wait() and Delay: durations, each multiplied by the iterations of the loops around it. */
    static long estimateDelayMs(List<Instruction> window) {
        Deque<Long> multipliers = new ArrayDeque<>();
        multipliers.push(1L);
        long total = 0;
        for (Instruction instruction : window) {
            switch (instruction.type()) {
                case LOOP_START -> multipliers.push(multipliers.peek() * Math.max(0, instruction.count()));
                case LOOP_END -> {
                    if (multipliers.size() > 1) {
                        multipliers.pop();
                    }
                }
                case COMMAND -> {
                    Matcher wait = WAIT.matcher(instruction.payload());
                    if (wait.find()) {
                        total += (long) Double.parseDouble(wait.group(1)) * multipliers.peek();
                    }
                }
                case DELAY -> {
                    try {
                        total += DelayExecutor.parse(instruction.payload()).toMillis() * multipliers.peek();
                    } catch (IllegalArgumentException e) {
                        log.debug("Delay at line {} not counted: {}", instruction.line(), e.getMessage());
                    }
                }
                default -> { }
            }
        }
        return total;
    }

    static String formatHms(long millis) {
        long seconds = millis / 1000;
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
