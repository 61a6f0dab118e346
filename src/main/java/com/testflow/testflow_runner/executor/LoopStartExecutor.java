package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.LoopState;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.ScriptLoop;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@code Loop_start(<id>):<n>}. Entering from outside starts the counter at 1; a counter past
 * {@code n} (only possible for n = 0) leaves the loop straight away. The optional entry
 * reference is taken once the header lines ran.
 */
@Component
@RequiredArgsConstructor
public class LoopStartExecutor implements InstructionExecutor {

    private final LoopEndExecutor loopEnd;

    @Override
    public InstructionType supportedType() {
        return InstructionType.LOOP_START;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        ScriptLoop loop = ctx.getGraph().loop(instruction.id())
                .orElseThrow(() -> new IllegalStateException("Unknown loop " + instruction.id()));
        LoopState state = ctx.loopState(loop);

        if (!state.isActive()) {
            state.setIteration(1);
        }
        if (state.isExhausted()) {
            return loopEnd.leave(ctx, loop, state);
        }

        ctx.log("Loop {} iteration {}/{}", loop.getId(), state.getIteration(), loop.getIterations());
        ctx.getGraph().referenceAt(instruction.line()).ifPresent(ctx::setPendingEntry);
        return StepOutcome.next();
    }
}
