package com.testflow.testflow_runner.model.script;

public enum ReferenceKind {
    NODE,       // N<k>: start line of node k
    LOOP_END,   // LE<k>: end line of loop k
    LINE,       // implicit fallthrough to a fixed line
    TERMINAL
}
