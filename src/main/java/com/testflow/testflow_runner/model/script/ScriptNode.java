package com.testflow.testflow_runner.model.script;

import lombok.Builder;
import lombok.Value;

/**
 * A standard or conditional node. Standard nodes carry {@code successor}; conditional
 * nodes carry {@code expression} and the two branch references instead.
 */
@Value
@Builder
public class ScriptNode {
    int id;
    NodeKind kind;
    int startLine;
    Integer endLine;
    NodeDescriptor descriptor;
    Reference successor;
    String expression;
    Reference whenTrue;
    Reference whenFalse;

    public boolean isConditional() {
        return kind == NodeKind.CONDITIONAL;
    }
}
