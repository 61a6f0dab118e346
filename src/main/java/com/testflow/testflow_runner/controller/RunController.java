package com.testflow.testflow_runner.controller;

import com.testflow.testflow_runner.control.RunSignal;
import com.testflow.testflow_runner.service.RunHandle;
import com.testflow.testflow_runner.service.RunNotFoundException;
import com.testflow.testflow_runner.service.RunRegistry;
import com.testflow.testflow_runner.service.RunReport;
import com.testflow.testflow_runner.service.RunRequest;
import com.testflow.testflow_runner.service.ScriptRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class RunController {

    private final ScriptRunService runService;
    private final RunRegistry registry;

    // POST /api/runs: starts a script in the background
    @PostMapping
    public ResponseEntity<?> start(@RequestBody StartRunRequest body) {
        try {
            RunHandle handle = runService.start(new RunRequest(body.scriptPath(), body.outputDir(), body.debug()));
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(toSummary(handle));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // GET /api/runs: every run of this process, newest first
    @GetMapping
    public List<RunSummary> listAll() {
        return registry.all().stream().map(this::toSummary).toList();
    }

    // GET /api/runs/{id}: summary plus the final report once the run ended
    @GetMapping("/{id}")
    public ResponseEntity<RunDetail> getById(@PathVariable String id) {
        return registry.find(id)
                .map(handle -> ResponseEntity.ok(new RunDetail(toSummary(handle), handle.getReport(),
                        handle.getRunLog().lines())))
                .orElse(ResponseEntity.notFound().build());
    }

    // POST /api/runs/{id}/control: { "signal": "pause" | "resume" | "stop" }
    @PostMapping("/{id}/control")
    public ResponseEntity<?> control(@PathVariable String id, @RequestBody ControlRequest body) {
        RunSignal signal = parseSignal(body.signal());
        if (signal == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "signal must be pause, resume or stop"));
        }
        try {
            return ResponseEntity.ok(toSummary(runService.signal(id, signal)));
        } catch (RunNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    private static RunSignal parseSignal(String text) {
        if (text == null) {
            return null;
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "pause" -> RunSignal.PAUSE;
            case "resume" -> RunSignal.RESUME;
            case "stop" -> RunSignal.STOP;
            default -> null;
        };
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private RunSummary toSummary(RunHandle handle) {
        return new RunSummary(
                handle.getRunId(),
                handle.getRequest().scriptPath(),
                handle.getStatus().name(),
                handle.getRunDirectory().toString(),
                handle.getCreatedAt().toString(),
                handle.getRunState().poll().text()
        );
    }

    public record StartRunRequest(String scriptPath, String outputDir, boolean debug) {}

    public record ControlRequest(String signal) {}

    public record RunSummary(String runId, String scriptPath, String status, String runDirectory,
                             String createdAt, String runState) {}

    public record RunDetail(RunSummary summary, RunReport report, List<String> log) {}
}
