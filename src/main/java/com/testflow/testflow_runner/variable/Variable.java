package com.testflow.testflow_runner.variable;

import lombok.Getter;

import java.util.List;

/**
 * A declared variable. The value sequence is fixed at parse time; only the cursor moves.
 * The cursor holds a Double, or a String once {@code save2var} copied an instrument reply.
 */
@Getter
public class Variable {

    private final String name;
    private final List<Double> values;
    private Object currentValue;

    public Variable(String name, List<Double> values) {
        this.name = name;
        this.values = List.copyOf(values);
        this.currentValue = this.values.isEmpty() ? null : this.values.get(0);
    }

    public void assign(Object value) {
        this.currentValue = value;
    }

    public String currentText() {
        return ValueFormat.format(currentValue);
    }
}
