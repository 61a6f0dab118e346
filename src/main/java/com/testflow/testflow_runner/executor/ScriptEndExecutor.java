package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import org.springframework.stereotype.Component;

@Component
public class ScriptEndExecutor implements InstructionExecutor {

    @Override
    public InstructionType supportedType() {
        return InstructionType.SCRIPT_END;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        return StepOutcome.terminate();
    }
}
