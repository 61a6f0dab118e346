package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.parser.ScriptParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptAnalyzerTest {

    private final ScriptParser parser = new ScriptParser(new TestflowProperties());
    private final ScriptAnalyzer analyzer = new ScriptAnalyzer(parser);

    private static final String SCRIPT = String.join("\n",
            "#START_SCRIPT",
            "Loop_start(1):3",
            "Variable:Vin",
            "Range:(1,3),(10,12,1)",
            "#NODE1(Source, PSU, Rigol, DP832)",
            "#ACTION:(Set)",
            "CMD:VOLT ${Vin}",
            "CMD:wait(500)",
            "Delay:1,S",
            "#ACTION:(Read)",
            "CMD:MEAS:VOLT?",
            "#END_NODE1(N5)",
            "Loop_end(1)",
            "#END_SCRIPT");

    @Test
    void summarisesStructureAndEstimatesDelays() {
        ScriptAnalysis analysis = analyzer.analyze(parser.parse("psu.atoms", SCRIPT));

        assertThat(analysis.windowStart()).isEqualTo(1);
        assertThat(analysis.windowEnd()).isEqualTo(14);
        assertThat(analysis.nodes()).singleElement().satisfies(node -> {
            assertThat(node.type()).isEqualTo("Source");
            assertThat(node.instrument()).isEqualTo("PSU");
        });
        assertThat(analysis.loops()).singleElement().satisfies(loop -> assertThat(loop.iterations()).isEqualTo(3));
        assertThat(analysis.variables()).containsEntry("Vin", java.util.List.of(10.0, 11.0, 12.0));
        assertThat(analysis.expectedSteps()).isEqualTo(3);
        assertThat(analysis.estimatedDelayMs()).isEqualTo(4500);
        assertThat(analysis.estimatedDelay()).isEqualTo("00:00:04");
        assertThat(analysis.resultHeader()).containsExactly("N", "Loop(1)", "Vin", "Read(N1|A2)", "Date", "Time");
        assertThat(analysis.warnings()).singleElement().asString().contains("N5");
    }

    @Test
    void formatsHoursMinutesSeconds() {
        assertThat(ScriptAnalyzer.formatHms(3_726_000)).isEqualTo("01:02:06");
    }

    @Test
    void analyzesScriptFile(@TempDir Path dir) throws IOException {
        Path script = Files.writeString(dir.resolve("psu.atoms"), SCRIPT);

        assertThat(analyzer.analyze(script.toString()).script()).isEqualTo("psu.atoms");
    }

    @Test
    void missingFileIsRejected(@TempDir Path dir) {
        assertThatThrownBy(() -> analyzer.analyze(dir.resolve("none.atoms").toString()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.analyze(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
