package com.testflow.testflow_runner.result;

import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.model.script.VariableDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives the result header from the executable window:
 * {@code N, Loop(<id>)..., <variables>..., <action columns>..., Date, Time}.
 *
 * An action contributes a column only when it holds a query ({@code CMD:}/{@code SER:} with
 * '?', {@code QRY:}), and an img / set sibling for {@code PNG:} / {@code SET:} lines.
 */
public final class ResultSchemaBuilder {

    private ResultSchemaBuilder() {
    }

    public static ResultSchema build(ScriptGraph graph) {
        Set<Integer> loopIds = new TreeSet<>();
        Set<String> variables = new LinkedHashSet<>();
        Set<String> actionColumns = new LinkedHashSet<>();

        for (VariableDeclaration declaration : graph.getVariables().values()) {
            variables.add(declaration.name());
        }

        ActionScan action = null;
        Integer node = null;
        int actionIndex = 0;
        for (Instruction instruction : graph.windowInstructions()) {
            switch (instruction.type()) {
                case LOOP_START -> loopIds.add(instruction.id());
                case NODE_START -> {
                    flush(action, actionColumns);
                    action = null;
                    node = instruction.id();
                    actionIndex = 0;
                }
                case NODE_END -> {
                    flush(action, actionColumns);
                    action = null;
                    node = null;
                }
                case ACTION -> {
                    flush(action, actionColumns);
                    action = null;
                    if (node != null) {
                        actionIndex++;
                        action = new ActionScan(instruction.payload(), node, actionIndex);
                    }
                }
                case COMMAND, SERIAL -> {
                    if (action != null && instruction.payload().contains("?")) {
                        action.query = true;
                    }
                }
                case QUERY -> {
                    if (action != null) {
                        action.query = true;
                    }
                }
                case IMAGE_CAPTURE -> {
                    if (action != null) {
                        action.image = true;
                    }
                }
                case SET_CAPTURE -> {
                    if (action != null) {
                        action.settings = true;
                    }
                }
                default -> { }
            }
        }
        flush(action, actionColumns);

        List<String> columns = new ArrayList<>();
        columns.add(ResultColumns.ROW);
        loopIds.forEach(id -> columns.add(ResultColumns.loop(id)));
        columns.addAll(variables);
        columns.addAll(actionColumns);
        columns.add(ResultColumns.DATE);
        columns.add(ResultColumns.TIME);
        return new ResultSchema(columns);
    }

    private static void flush(ActionScan action, Set<String> columns) {
        if (action == null || action.title.isBlank()) {
            return;
        }
        if (action.query) {
            columns.add(ResultColumns.measurement(action.title, action.node, action.index));
        }
        if (action.image) {
            columns.add(ResultColumns.image(action.title, action.node, action.index));
        }
        if (action.settings) {
            columns.add(ResultColumns.settings(action.title, action.node, action.index));
        }
    }

    private static final class ActionScan {
        final String title;
        final int node;
        final int index;
        boolean query;
        boolean image;
        boolean settings;

        ActionScan(String title, int node, int index) {
            this.title = title;
            this.node = node;
            this.index = index;
        }
    }
}
