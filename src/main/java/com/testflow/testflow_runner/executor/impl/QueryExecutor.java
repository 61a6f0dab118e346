package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.transport.TransportChannel;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class QueryExecutor implements InstructionExecutor {

    private final InstrumentIo io;

    @Override
    public InstructionType supportedType() {
        return InstructionType.QUERY;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        String text = PlaceholderSubstitutor.substitute(instruction.payload(), ctx.getVariables());
        io.queryAndRecord(ctx, TransportChannel.VISA, text);
        return StepOutcome.next();
    }
}
