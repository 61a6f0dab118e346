package com.testflow.testflow_runner.result;

/** Receives the complete table every time the recorder flushes. */
@FunctionalInterface
public interface ResultSink {

    ResultSink NONE = table -> { };

    void write(ResultTable table);
}
