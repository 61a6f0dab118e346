package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.LoopState;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.ScriptLoop;
import com.testflow.testflow_runner.result.ResultRecorder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@code Loop_end(<id>)}: closes the current data row, then either starts the next pass or
 * leaves through the exit reference (or the next line).
 */
@Component
@RequiredArgsConstructor
public class LoopEndExecutor implements InstructionExecutor {

    private final ResultRecorder recorder;

    @Override
    public InstructionType supportedType() {
        return InstructionType.LOOP_END;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        ScriptLoop loop = ctx.getGraph().loop(instruction.id())
                .orElseThrow(() -> new IllegalStateException("Unknown loop " + instruction.id()));
        LoopState state = ctx.loopState(loop);

        recorder.finalizeRow(ctx);
        state.setIteration(state.getIteration() + 1);
        if (!state.isExhausted()) {
            return StepOutcome.jump(loop.getStartLine());
        }
        return leave(ctx, loop, state);
    }

    StepOutcome leave(RunContext ctx, ScriptLoop loop, LoopState state) {
        state.reset();
        ctx.log("Loop {} finished", loop.getId());
        return ctx.getGraph().referenceAt(loop.getEndLine())
                .map(StepOutcome::follow)
                .orElseGet(() -> StepOutcome.jump(loop.getEndLine() + 1));
    }
}
