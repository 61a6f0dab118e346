package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.engine.ScriptExecutionEngine;
import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * {@code Work_flow:(<name>)}: runs the first captured block of that name synchronously and
 * splices its results into this run. A stopped or failed child ends the parent the same way.
 */
@Component
public class SubWorkflowExecutor implements InstructionExecutor {

    private final ScriptExecutionEngine engine;

    // @Lazy breaks the engine -> registry -> executor -> engine cycle
    public SubWorkflowExecutor(@Lazy ScriptExecutionEngine engine) {
        this.engine = engine;
    }

    @Override
    public InstructionType supportedType() {
        return InstructionType.WORKFLOW_CALL;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        return engine.runWorkflow(instruction.payload(), ctx);
    }
}
