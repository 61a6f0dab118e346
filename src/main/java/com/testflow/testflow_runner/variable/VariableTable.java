package com.testflow.testflow_runner.variable;

import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.model.script.VariableDeclaration;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Mutable per-run variable state, built once from the declarations of a parsed script. */
public class VariableTable {

    private final Map<String, Variable> variables = new LinkedHashMap<>();

    public static VariableTable from(ScriptGraph graph) {
        VariableTable table = new VariableTable();
        for (VariableDeclaration declaration : graph.getVariables().values()) {
            table.variables.putIfAbsent(declaration.name(),
                    new Variable(declaration.name(), declaration.values()));
        }
        return table;
    }

    public Optional<Variable> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    /** Assigns a value, declaring the variable on the fly when it does not exist yet. */
    public Variable assign(String name, Object value) {
        Variable variable = variables.computeIfAbsent(name, n -> new Variable(n, java.util.List.of()));
        variable.assign(value);
        return variable;
    }

    public Collection<Variable> all() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public Map<String, String> snapshot() {
        Map<String, String> values = new LinkedHashMap<>();
        variables.forEach((name, variable) -> values.put(name, variable.currentText()));
        return values;
    }
}
