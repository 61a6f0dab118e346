package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.result.ResultRecorder;
import com.testflow.testflow_runner.transport.TransportReply;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Binary captures: the reply bytes go to an artifact file of the run, the file path goes to
 * the action's img / set column.
 */
@RequiredArgsConstructor
abstract class CaptureExecutor implements InstructionExecutor {

    protected final InstrumentIo io;
    protected final ResultRecorder recorder;

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        String text = PlaceholderSubstitutor.substitute(instruction.payload(), ctx.getVariables());
        TransportReply reply = io.queryBinary(ctx, text);
        if (!reply.ok() || reply.data() == null) {
            recorder.markMeasured(ctx);
            return StepOutcome.next();
        }
        try {
            Path file = ctx.getEnvironment().artifacts().store(ctx.getCurrentRow(), extension(), reply.data());
            ctx.log("Captured {} bytes to {}", reply.data().length, file.getFileName());
            recorder.recordMeasurement(ctx, column(ctx), file.toString());
        } catch (IOException e) {
            ctx.log("Cannot store capture of '{}': {}", text, e.getMessage());
            recorder.markMeasured(ctx);
        }
        return StepOutcome.next();
    }

    protected abstract String extension();

    protected abstract String column(RunContext ctx);
}
