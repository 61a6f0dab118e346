package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;

public interface InstructionExecutor {

    InstructionType supportedType();

    // Runs one script line against the run context and tells the engine where to go next
    StepOutcome execute(Instruction instruction, RunContext ctx);
}
