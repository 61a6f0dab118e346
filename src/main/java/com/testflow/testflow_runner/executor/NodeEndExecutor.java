package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.Reference;
import org.springframework.stereotype.Component;

/** Follows the node's successor: inline N / LE reference, else the line after the end marker. */
@Component
public class NodeEndExecutor implements InstructionExecutor {

    @Override
    public InstructionType supportedType() {
        return InstructionType.NODE_END;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        Reference successor = ctx.getGraph().referenceAt(instruction.line())
                .orElse(Reference.terminal(instruction.line()));
        ctx.log("Node {} ended, next: {}", instruction.id(), successor.label());
        return StepOutcome.follow(successor);
    }
}
