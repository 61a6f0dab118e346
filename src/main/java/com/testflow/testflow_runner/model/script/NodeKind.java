package com.testflow.testflow_runner.model.script;

public enum NodeKind {
    STANDARD,
    CONDITIONAL
}
