package com.testflow.testflow_runner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.control.RunSignal;
import com.testflow.testflow_runner.model.run.RunStatus;
import com.testflow.testflow_runner.support.RecordingSleeper;
import com.testflow.testflow_runner.support.RecordingTransport;
import com.testflow.testflow_runner.support.TestEngines;
import com.testflow.testflow_runner.support.TestEngines.Fixture;
import com.testflow.testflow_runner.transport.TransportRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptRunServiceTest {

    private static final String SCRIPT = String.join("\n",
            "#START_SCRIPT",
            "Loop_start(1):2",
            "#NODE1(Measure, DMM)",
            "INST::GPIB0::22::INSTR",
            "#ACTION:(Vout)",
            "CMD:MEAS:VOLT?",
            "#END_NODE1",
            "Loop_end(1)",
            "#END_SCRIPT");

    @TempDir
    Path dir;

    private final RecordingTransport transport = new RecordingTransport().reply("MEAS:VOLT?", "5.01");
    private final TestflowProperties properties = new TestflowProperties();
    private final RunRegistry registry = new RunRegistry(properties);
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor();

    private ScriptRunService service() {
        RecordingSleeper sleeper = new RecordingSleeper();
        Fixture fixture = TestEngines.create(transport, properties, sleeper);
        InstrumentValidator validator = new InstrumentValidator(new TransportRegistry(List.of(transport)), properties);
        return new ScriptRunService(fixture.parser(), fixture.engine(), validator, registry, properties, sleeper,
                objectMapper, TestEngines.CLOCK, runExecutor);
    }

    private Path script(String content) throws IOException {
        return Files.writeString(dir.resolve("bench.atoms"), content);
    }

    @AfterEach
    void tearDown() {
        runExecutor.shutdownNow();
    }

    @Test
    void runSyncWritesCsvLogAndSummary() throws IOException {
        Path script = script(SCRIPT);

        RunReport report = service().runSync(new RunRequest(script.toString(), dir.resolve("out").toString(), false));

        Path runDirectory = dir.resolve("out").resolve("bench_2026-03-14_09-26-53");
        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.rows()).isEqualTo(2);
        assertThat(report.steps()).isEqualTo(2);
        assertThat(report.expectedSteps()).isEqualTo(2);
        assertThat(Path.of(report.runDirectory())).isEqualTo(runDirectory);
        assertThat(Path.of(report.csvFile())).isEqualTo(runDirectory.resolve("Out2026-03-14_0926.csv"));

        List<String> csv = Files.readAllLines(Path.of(report.csvFile()));
        assertThat(csv).containsExactly(
                "N,Loop(1),Vout(N1|A1),Date,Time",
                "1,1,5.01,2026-03-14,09:26:53",
                "2,2,5.01,2026-03-14,09:26:53");

        assertThat(Files.readAllLines(Path.of(report.logFile())))
                .anyMatch(line -> line.contains("TEST FLOW"))
                .anyMatch(line -> line.contains("TEST DONE"));

        JsonNode summary = objectMapper.readTree(runDirectory.resolve(ScriptRunService.SUMMARY_FILE).toFile());
        assertThat(summary.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(summary.get("rows").asInt()).isEqualTo(2);

        assertThat(runDirectory.resolve("status.txt")).doesNotExist();
        assertThat(registry.find(report.runId())).isPresent();
    }

    @Test
    void runDirectoryDefaultsToScriptFolder() throws IOException {
        Path script = script(SCRIPT);

        RunReport report = service().runSync(new RunRequest(script.toString(), null, false));

        assertThat(Path.of(report.runDirectory()).getParent()).isEqualTo(dir.toAbsolutePath());
    }

    @Test
    void structuralErrorEndsInFailedReport() throws IOException {
        Path script = script("#START_SCRIPT\nLoop_start(1):2\n#END_SCRIPT");

        RunReport report = service().runSync(new RunRequest(script.toString(), null, false));

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.error()).contains("never closed");
        assertThat(Files.readAllLines(Path.of(report.logFile()))).anyMatch(line -> line.contains("TEST FAILED"));
        assertThat(transport.queries()).isEmpty();
    }

    @Test
    void unreachableInstrumentFailsWhenRequired() throws IOException {
        properties.getTransport().setRequireReachable(true);
        transport.fail("*IDN?");
        Path script = script(SCRIPT);

        RunReport report = service().runSync(new RunRequest(script.toString(), null, false));

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.error()).isEqualTo("Instruments not reachable: GPIB0::22::INSTR");
        assertThat(transport.queries()).containsExactly("GPIB0::22::INSTR|*IDN?");
    }

    @Test
    void unreachableInstrumentOnlyWarnsByDefault() throws IOException {
        transport.fail("*IDN?");
        Path script = script(SCRIPT);

        RunReport report = service().runSync(new RunRequest(script.toString(), null, false));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(Files.readAllLines(Path.of(report.logFile())))
                .anyMatch(line -> line.contains("WARNING: instrument GPIB0::22::INSTR is not reachable"));
    }

    @Test
    void startRunsInBackgroundAndCompletesHandle() throws Exception {
        Path script = script(SCRIPT);

        RunHandle handle = service().start(new RunRequest(script.toString(), null, false));
        assertThat(registry.find(handle.getRunId())).containsSame(handle);

        runExecutor.shutdown();
        assertThat(runExecutor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(handle.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(handle.getReport().rows()).isEqualTo(2);
    }

    @Test
    void signalRejectsUnknownAndFinishedRuns() throws IOException {
        ScriptRunService service = service();
        RunReport report = service.runSync(new RunRequest(script(SCRIPT).toString(), null, false));

        assertThatThrownBy(() -> service.signal("nope", RunSignal.STOP))
                .isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> service.signal(report.runId(), RunSignal.PAUSE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already ended");
    }

    @Test
    void missingScriptIsRejectedBeforeAnythingIsCreated() {
        assertThatThrownBy(() -> service().runSync(new RunRequest(dir.resolve("absent.atoms").toString(), null, false)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Script not found");
        assertThat(registry.all()).isEmpty();
    }
}
