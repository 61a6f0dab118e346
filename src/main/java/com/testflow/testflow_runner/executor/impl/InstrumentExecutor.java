package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import org.springframework.stereotype.Component;

/** {@code INST::<address>} binds the instrument every following command talks to. */
@Component
public class InstrumentExecutor implements InstructionExecutor {

    @Override
    public InstructionType supportedType() {
        return InstructionType.INSTRUMENT;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        String address = PlaceholderSubstitutor.substitute(instruction.payload(), ctx.getVariables()).strip();
        ctx.setInstrumentAddress(address);
        ctx.log("Instrument bound: {}", address);
        return StepOutcome.next();
    }
}
