package com.testflow.testflow_runner.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory result table. Data rows are 1-based; row 0 is the header.
 *
 * Cell updates are idempotent (last write wins) and grow the table with blank rows until the
 * addressed row exists. Spliced sub-workflow blocks are stored verbatim and may be wider or
 * narrower than the header.
 */
public class ResultTable {

    static final String WORKFLOW_START_BANNER = "*** Starting script %s ***";
    static final String WORKFLOW_END_BANNER   = "*** Sub_script ended ***";

    private final ResultSchema schema;
    private final List<List<String>> rows = new ArrayList<>();

    public ResultTable(ResultSchema schema) {
        this.schema = schema;
    }

    public ResultSchema schema() {
        return schema;
    }

    public int rowCount() {
        return rows.size();
    }

    public void update(int row, String column, String value) {
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new UnknownColumnException(column);
        }
        update(row, index, value);
    }

    public void update(int row, int column, String value) {
        if (row < 1) {
            throw new IllegalArgumentException("Data rows start at 1, got " + row);
        }
        if (column < 0 || column >= schema.size()) {
            throw new UnknownColumnException("#" + column);
        }
        while (rows.size() < row) {
            rows.add(blankRow(schema.size()));
        }
        List<String> cells = rows.get(row - 1);
        while (cells.size() <= column) {
            cells.add("");
        }
        cells.set(column, value == null ? "" : value);
    }

    public String cell(int row, String column) {
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new UnknownColumnException(column);
        }
        if (row < 1 || row > rows.size()) {
            return "";
        }
        List<String> cells = rows.get(row - 1);
        return index < cells.size() ? cells.get(index) : "";
    }

    public List<String> row(int row) {
        return Collections.unmodifiableList(rows.get(row - 1));
    }

    /**
     * Appends a finished sub-workflow: start banner, the child's header and rows, end banner
     * and this table's header again. Returns the index of the last appended row.
     */
    public int splice(ResultTable child, String workflowName) {
        rows.add(bannerRow(String.format(WORKFLOW_START_BANNER, workflowName)));
        rows.add(new ArrayList<>(child.schema.columns()));
        for (List<String> childRow : child.rows) {
            rows.add(new ArrayList<>(childRow));
        }
        rows.add(bannerRow(WORKFLOW_END_BANNER));
        rows.add(new ArrayList<>(schema.columns()));
        return rows.size();
    }

    /** Header plus every data row, ready for a writer. */
    public List<List<String>> snapshot() {
        List<List<String>> copy = new ArrayList<>(rows.size() + 1);
        copy.add(schema.columns());
        for (List<String> row : rows) {
            copy.add(List.copyOf(row));
        }
        return copy;
    }

    private List<String> bannerRow(String text) {
        List<String> row = blankRow(Math.max(1, schema.size()));
        row.set(0, text);
        return row;
    }

    private static List<String> blankRow(int width) {
        return new ArrayList<>(Collections.nCopies(width, ""));
    }
}
