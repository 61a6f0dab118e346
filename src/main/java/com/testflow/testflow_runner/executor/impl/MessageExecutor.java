package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.control.RunSignal;
import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import org.springframework.stereotype.Component;

/**
 * {@code MESSAGE:<text>} pauses the run for the operator. The pause takes effect at the
 * engine's next suspension point.
 */
@Component
public class MessageExecutor implements InstructionExecutor {

    @Override
    public InstructionType supportedType() {
        return InstructionType.MESSAGE;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        String message = PlaceholderSubstitutor.substitute(instruction.payload(), ctx.getVariables());
        ctx.getEnvironment().runState().signal(RunSignal.PAUSE);
        ctx.log("Test paused with message: {}", message);
        return StepOutcome.next();
    }
}
