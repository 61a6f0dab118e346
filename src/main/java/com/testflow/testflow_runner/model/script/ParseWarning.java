package com.testflow.testflow_runner.model.script;

public record ParseWarning(int line, String message) {

    @Override
    public String toString() {
        return message;
    }
}
