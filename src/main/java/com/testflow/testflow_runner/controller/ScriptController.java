package com.testflow.testflow_runner.controller;

import com.testflow.testflow_runner.TestflowException;
import com.testflow.testflow_runner.service.ScriptAnalysis;
import com.testflow.testflow_runner.service.ScriptAnalyzer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.UncheckedIOException;
import java.util.Map;

@RestController
@RequestMapping("/api/scripts")
@RequiredArgsConstructor
public class ScriptController {

    private final ScriptAnalyzer analyzer;

    // POST /api/scripts/analyze: parse without running; structure, warnings, steps, time estimate
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody AnalyzeRequest body) {
        try {
            ScriptAnalysis analysis = analyzer.analyze(body.scriptPath());
            return ResponseEntity.ok(analysis);
        } catch (IllegalArgumentException | TestflowException | UncheckedIOException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    public record AnalyzeRequest(String scriptPath) {}
}
