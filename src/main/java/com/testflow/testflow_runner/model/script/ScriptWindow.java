package com.testflow.testflow_runner.model.script;

/** 1-based inclusive bounds of the executable region, marker lines included. */
public record ScriptWindow(int startLine, int endLine) {

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
}
