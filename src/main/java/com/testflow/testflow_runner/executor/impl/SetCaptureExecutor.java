package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.result.ResultColumns;
import com.testflow.testflow_runner.result.ResultRecorder;
import org.springframework.stereotype.Component;

/** {@code SET:} instrument settings capture stored as {@code image_<row>.set}. */
@Component
public class SetCaptureExecutor extends CaptureExecutor {
    public SetCaptureExecutor(InstrumentIo io, ResultRecorder recorder) { super(io, recorder); }

    @Override public InstructionType supportedType() { return InstructionType.SET_CAPTURE; }
    @Override protected String extension() { return "set"; }

    @Override
    protected String column(RunContext ctx) {
        return ResultColumns.settings(ctx.getActionTitle(), ctx.currentNodeId(), ctx.getActionIndex());
    }
}
