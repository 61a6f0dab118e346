package com.testflow.testflow_runner.launcher;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.service.RunReport;
import com.testflow.testflow_runner.service.RunRequest;
import com.testflow.testflow_runner.service.ScriptRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs one script at startup when {@code testflow.launch.script} is set, e.g.
 * {@code java -jar testflow-runner.jar --testflow.launch.script=bench.atoms --testflow.launch.output=out}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "testflow.launch", name = "script")
public class ScriptLauncher implements CommandLineRunner {

    private final ScriptRunService runService;
    private final TestflowProperties properties;

    @Override
    public void run(String... args) {
        TestflowProperties.Launch launch = properties.getLaunch();
        Path script = Path.of(launch.getScript());
        if (!Files.isRegularFile(script)) {
            log.error("Script file not found: {}", script.toAbsolutePath());
            return;
        }
        String output = launch.getOutput();
        if (output != null && !output.isBlank()) {
            try {
                Files.createDirectories(Path.of(output));
            } catch (IOException e) {
                log.error("Cannot create output directory {}: {}", output, e.getMessage());
                return;
            }
        }

        log.info("Launching {} (debug={})", script.toAbsolutePath(), launch.isDebug());
        RunReport report = runService.runSync(new RunRequest(script.toString(), output, launch.isDebug()));
        log.info("Run {} ended {}: {} rows, csv {}", report.runId(), report.status(), report.rows(), report.csvFile());
        if (report.error() != null) {
            log.error("Run {} error: {}", report.runId(), report.error());
        }
    }
}
