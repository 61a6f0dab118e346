package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.result.ResultColumns;
import com.testflow.testflow_runner.result.ResultRecorder;
import org.springframework.stereotype.Component;

/** {@code PNG:} screen capture stored as {@code image_<row>.png}. */
@Component
public class ImageCaptureExecutor extends CaptureExecutor {
    public ImageCaptureExecutor(InstrumentIo io, ResultRecorder recorder) { super(io, recorder); }

    @Override public InstructionType supportedType() { return InstructionType.IMAGE_CAPTURE; }
    @Override protected String extension() { return "png"; }

    @Override
    protected String column(RunContext ctx) {
        return ResultColumns.image(ctx.getActionTitle(), ctx.currentNodeId(), ctx.getActionIndex());
    }
}
