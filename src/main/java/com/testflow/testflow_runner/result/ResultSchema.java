package com.testflow.testflow_runner.result;

import java.util.LinkedHashSet;
import java.util.List;

/** Ordered, name-unique header of a result table. */
public final class ResultSchema {

    private final List<String> columns;

    public ResultSchema(List<String> columns) {
        this.columns = List.copyOf(new LinkedHashSet<>(columns));
    }

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public boolean contains(String column) {
        return columns.contains(column);
    }

    @Override
    public String toString() {
        return String.join(",", columns);
    }
}
