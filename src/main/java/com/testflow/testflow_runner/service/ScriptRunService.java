package com.testflow.testflow_runner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.control.FileRunState;
import com.testflow.testflow_runner.control.RunSignal;
import com.testflow.testflow_runner.control.Sleeper;
import com.testflow.testflow_runner.engine.ScriptExecutionEngine;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.run.RunEnvironment;
import com.testflow.testflow_runner.model.run.RunLog;
import com.testflow.testflow_runner.model.run.RunStatus;
import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.parser.ScriptParser;
import com.testflow.testflow_runner.result.ArtifactStore;
import com.testflow.testflow_runner.result.CsvResultWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs one script end to end: run directory, run-state token, parse, instrument check,
 * engine, CSV and log files, summary. Failures end up in the returned report, never as
 * exceptions, once the run directory exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptRunService {

    static final String SUMMARY_FILE = "run-summary.json";

    private static final DateTimeFormatter RUN_DIR = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter CSV_NAME = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmm");
    private static final String RULE = "=".repeat(60);

    private final ScriptParser parser;
    private final ScriptExecutionEngine engine;
    private final InstrumentValidator instrumentValidator;
    private final RunRegistry registry;
    private final TestflowProperties properties;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService runExecutor;

    /** Runs in the calling thread and returns the final report. */
    public RunReport runSync(RunRequest request) {
        RunHandle handle = prepare(request);
        registry.register(handle);
        return execute(handle);
    }

    /** Starts the run in the background; the handle is registered before this returns. */
    public RunHandle start(RunRequest request) {
        RunHandle handle = prepare(request);
        registry.register(handle);
        CompletableFuture.runAsync(() -> execute(handle), runExecutor);
        return handle;
    }

    public RunHandle signal(String runId, RunSignal signal) {
        RunHandle handle = registry.find(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
        if (handle.getStatus().isFinished()) {
            throw new IllegalStateException("Run " + runId + " already ended " + handle.getStatus());
        }
        handle.signal(signal);
        log.info("Run {} signalled {}", runId, signal.text());
        return handle;
    }

    RunHandle prepare(RunRequest request) {
        if (request.scriptPath() == null || request.scriptPath().isBlank()) {
            throw new IllegalArgumentException("scriptPath is required");
        }
        Path script = Path.of(request.scriptPath()).toAbsolutePath();
        if (!Files.isRegularFile(script)) {
            throw new IllegalArgumentException("Script not found: " + script);
        }
        Path outputRoot = request.outputDir() == null || request.outputDir().isBlank()
                ? script.getParent()
                : Path.of(request.outputDir()).toAbsolutePath();

        LocalDateTime now = LocalDateTime.now(clock);
        Path runDirectory = outputRoot.resolve(stem(script) + "_" + now.format(RUN_DIR));
        String csvName = "Out" + now.format(CSV_NAME);
        try {
            Files.createDirectories(runDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create run directory " + runDirectory, e);
        }

        String runId = UUID.randomUUID().toString();
        FileRunState runState = new FileRunState(runDirectory.resolve(properties.getControl().getStatusFile()));
        runState.signal(RunSignal.RUNNING);

        return new RunHandle(runId, request, runDirectory,
                runDirectory.resolve(csvName + ".csv"),
                runDirectory.resolve(csvName + ".log"),
                runState,
                new RunLog(runId, clock),
                clock.instant());
    }

    RunReport execute(RunHandle handle) {
        RunLog runLog = handle.getRunLog();
        Path script = Path.of(handle.getRequest().scriptPath()).toAbsolutePath();
        banner(runLog, "TEST FLOW");
        runLog.add("Script: " + script);
        runLog.add("Output: " + handle.getRunDirectory());

        Instant startedAt = clock.instant();
        RunStatus status;
        String error = null;
        int rows = 0;
        long steps = 0;
        long expectedSteps = 0;
        List<String> warnings = List.of();

        try {
            ScriptGraph graph = parser.parse(script);
            warnings = graph.getWarnings().stream().map(ParseWarning::message).toList();
            warnings.forEach(warning -> runLog.add("WARNING: " + warning));
            expectedSteps = graph.getExpectedSteps();
            runLog.add("Total steps expected: " + expectedSteps);

            instrumentValidator.validate(graph, runLog);

            CsvResultWriter writer = new CsvResultWriter(handle.getCsvFile(),
                    properties.getResult().getWriteRetries(), properties.getResult().getWriteBackoff(), sleeper);
            RunEnvironment environment = new RunEnvironment(handle.getRunId(), handle.getRunState(),
                    new ArtifactStore(handle.getRunDirectory()), runLog, handle.getRequest().debug());

            RunContext ctx = engine.execute(graph, environment, writer);
            status = ctx.getStatus();
            error = ctx.getErrorMessage();
            rows = ctx.getRowsWritten();
            steps = ctx.getStepCount();
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Run {} of {} failed: {}", handle.getRunId(), script, msg, ex);
            runLog.add("ERROR: " + msg);
            handle.getRunState().clear();
            status = RunStatus.FAILED;
            error = msg;
        }

        switch (status) {
            case COMPLETED -> banner(runLog, "TEST DONE");
            case STOPPED -> banner(runLog, "TEST STOPPED");
            default -> banner(runLog, "TEST FAILED");
        }

        RunReport report = new RunReport(handle.getRunId(), script.toString(), status,
                handle.getRunDirectory().toString(), handle.getCsvFile().toString(), handle.getLogFile().toString(),
                rows, steps, expectedSteps, warnings, error, startedAt, clock.instant());
        persist(handle, report);
        handle.complete(report);
        registry.evictFinished();
        return report;
    }

    private void persist(RunHandle handle, RunReport report) {
        try {
            handle.getRunLog().writeTo(handle.getLogFile());
        } catch (IOException e) {
            log.warn("Cannot write run log {}: {}", handle.getLogFile(), e.getMessage());
        }
        try {
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(handle.getRunDirectory().resolve(SUMMARY_FILE).toFile(), report);
        } catch (IOException e) {
            log.warn("Cannot write run summary for {}: {}", handle.getRunId(), e.getMessage());
        }
    }

    private static void banner(RunLog runLog, String title) {
        runLog.add(RULE);
        runLog.add(" ".repeat(Math.max(0, (RULE.length() - title.length()) / 2)) + title);
        runLog.add(RULE);
    }

    private static String stem(Path script) {
        String name = script.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
