package com.testflow.testflow_runner.result;

import com.testflow.testflow_runner.model.run.LoopState;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.variable.Variable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes measurements into the current data row of a run and closes rows. A row is only
 * closed (N, Date, Time, loop counters, variable values) once it received a measurement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultRecorder {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;

    public void recordMeasurement(RunContext ctx, String column, String value) {
        ResultTable table = ctx.getResults();
        ctx.setRowDirty(true);
        if (!table.schema().contains(column)) {
            log.warn("Column {} is not part of the result header of {}; value dropped", column, ctx.getGraph().getName());
            ctx.log("Column {} not in result header, value '{}' dropped", column, value);
            return;
        }
        table.update(ctx.getCurrentRow(), column, value);
    }

    /** A measurement was attempted; the row is closed even when the cell stays empty. */
    public void markMeasured(RunContext ctx) {
        ctx.setRowDirty(true);
    }

    /** @return true when a row was closed */
    public boolean finalizeRow(RunContext ctx) {
        if (!ctx.isRowDirty()) {
            return false;
        }
        ResultTable table = ctx.getResults();
        ResultSchema schema = table.schema();
        int row = ctx.getCurrentRow();
        LocalDateTime now = LocalDateTime.now(clock);

        table.update(row, ResultColumns.ROW, String.valueOf(row));
        for (LoopState state : ctx.getLoopStates().values()) {
            String column = ResultColumns.loop(state.getLoopId());
            if (state.isActive() && schema.contains(column)) {
                table.update(row, column, String.valueOf(Math.min(state.getIteration(), state.getIterations())));
            }
        }
        for (Variable variable : ctx.getVariables().all()) {
            if (schema.contains(variable.getName())) {
                table.update(row, variable.getName(), variable.currentText());
            }
        }
        table.update(row, ResultColumns.DATE, now.format(DATE));
        table.update(row, ResultColumns.TIME, now.format(TIME));

        ctx.setRowDirty(false);
        ctx.setRowsWritten(ctx.getRowsWritten() + 1);
        ctx.setCurrentRow(table.rowCount() + 1);
        flush(ctx);
        return true;
    }

    /** Appends a finished sub-workflow's table to the parent's. */
    public void splice(RunContext parent, RunContext child, String workflowName) {
        finalizeRow(parent);
        int last = parent.getResults().splice(child.getResults(), workflowName);
        parent.setCurrentRow(last + 1);
        flush(parent);
    }

    public void flush(RunContext ctx) {
        ctx.getSink().write(ctx.getResults());
    }
}
