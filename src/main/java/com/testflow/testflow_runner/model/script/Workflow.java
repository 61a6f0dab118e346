package com.testflow.testflow_runner.model.script;

import java.util.List;

public record Workflow(String name, int startLine, int endLine, List<String> lines) {

    public Workflow {
        lines = List.copyOf(lines);
    }

    public String content() {
        return String.join("\n", lines);
    }
}
