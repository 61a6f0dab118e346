package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.TestflowException;

/** Script structure that cannot be executed at all; raised before any instrument is touched. */
public class StructuralParseException extends TestflowException {

    private final int line;

    public StructuralParseException(String message) {
        this(-1, message);
    }

    public StructuralParseException(int line, String message) {
        super(line > 0 ? "Line " + line + ": " + message : message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
