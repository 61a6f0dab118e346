package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.LoopState;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.VariableDeclaration;
import com.testflow.testflow_runner.variable.Variable;
import org.springframework.stereotype.Component;

/** Moves the variable's cursor to the value declared for the governing loop's current iteration. */
@Component
public class VariableExecutor implements InstructionExecutor {

    @Override
    public InstructionType supportedType() {
        return InstructionType.VARIABLE;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        VariableDeclaration declaration = ctx.getGraph().variableAt(instruction.line()).orElse(null);
        if (declaration == null) {
            return StepOutcome.next();
        }
        Variable variable = ctx.getVariables().get(declaration.name()).orElse(null);
        if (variable == null) {
            return StepOutcome.next();
        }

        int iteration = 1;
        if (declaration.governingLoopId() != null) {
            LoopState state = ctx.getLoopStates().get(declaration.governingLoopId());
            iteration = state == null ? 1 : Math.max(1, state.getIteration());
        }
        int index = Math.min(iteration, declaration.values().size()) - 1;
        variable.assign(declaration.values().get(index));
        ctx.log("Variable {} = {}", variable.getName(), variable.currentText());
        return StepOutcome.next();
    }
}
