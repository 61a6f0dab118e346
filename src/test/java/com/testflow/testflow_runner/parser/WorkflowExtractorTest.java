package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.Workflow;
import com.testflow.testflow_runner.model.script.WorkflowCatalog;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowExtractorTest {

    private final List<ParseWarning> warnings = new ArrayList<>();

    private WorkflowCatalog extract(boolean caseSensitive, String... lines) {
        List<String> script = List.of(lines);
        return new WorkflowExtractor(caseSensitive).extract(script, new ScriptLexer(caseSensitive).lex(script), warnings);
    }

    @Test
    void capturesBlockBetweenMarkers() {
        WorkflowCatalog catalog = extract(true,
                "#START_SCRIPT",
                "#END_SCRIPT",
                "#START_WORKFLOW(Warmup)",
                "#NODE1",
                "#END_NODE1",
                "#END_WORKFLOW(Warmup)");

        Workflow warmup = catalog.first("Warmup").orElseThrow();
        assertThat(warmup.startLine()).isEqualTo(3);
        assertThat(warmup.endLine()).isEqualTo(6);
        assertThat(warmup.lines()).containsExactly("#NODE1", "#END_NODE1");
        assertThat(warnings).isEmpty();
    }

    @Test
    void duplicateNamesKeepEveryInstanceFirstWins() {
        WorkflowCatalog catalog = extract(true,
                "#START_WORKFLOW(A)", "first", "#END_WORKFLOW(A)",
                "#START_WORKFLOW(A)", "second", "#END_WORKFLOW(A)");

        assertThat(catalog.instances("A")).hasSize(2);
        assertThat(catalog.first("A").orElseThrow().lines()).containsExactly("first");
    }

    @Test
    void unterminatedStartWarnsAndIsSkipped() {
        WorkflowCatalog catalog = extract(true, "#START_WORKFLOW(A)", "#NODE1");

        assertThat(catalog.contains("A")).isFalse();
        assertThat(warnings).singleElement()
                .satisfies(w -> assertThat(w.message()).contains("has no #END_WORKFLOW(A)"));
    }

    @Test
    void strayEndWarns() {
        extract(true, "#END_WORKFLOW(B)");

        assertThat(warnings).singleElement()
                .satisfies(w -> assertThat(w.message()).contains("has no matching start"));
    }

    @Test
    void namesMatchIgnoringCaseWhenConfigured() {
        WorkflowCatalog catalog = extract(false, "#START_WORKFLOW(Warmup)", "x", "#END_WORKFLOW(WARMUP)");

        assertThat(catalog.contains("warmup")).isTrue();
    }
}
