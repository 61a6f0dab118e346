package com.testflow.testflow_runner.model.script;

import java.util.List;

/**
 * A {@code Variable:} line with its expanded {@code Range} values. {@code governingLoopId}
 * is the innermost loop around the declaration, or null at top level.
 */
public record VariableDeclaration(String name, int line, List<Double> values, Integer governingLoopId) {

    public VariableDeclaration {
        values = List.copyOf(values);
    }
}
