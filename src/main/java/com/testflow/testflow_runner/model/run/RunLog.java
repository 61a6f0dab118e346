package com.testflow.testflow_runner.model.run;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable log of one run, persisted beside the result file when the run ends.
 * Every line is mirrored to the application log.
 */
@Slf4j
public class RunLog {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String runId;
    private final Clock clock;
    private final List<String> lines = new ArrayList<>();

    public RunLog(String runId, Clock clock) {
        this.runId = runId;
        this.clock = clock;
    }

    public synchronized void add(String message) {
        lines.add("[" + LocalDateTime.now(clock).format(STAMP) + "]: " + message);
        log.info("[{}] {}", runId, message);
    }

    public synchronized List<String> lines() {
        return List.copyOf(lines);
    }

    public synchronized void writeTo(Path file) throws IOException {
        Files.write(file, lines, StandardCharsets.UTF_8);
    }
}
