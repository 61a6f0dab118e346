package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.NodeDescriptor;
import com.testflow.testflow_runner.model.script.Reference;
import com.testflow.testflow_runner.model.script.ScriptNode;
import com.testflow.testflow_runner.variable.ExpressionEvaluator;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import org.springframework.stereotype.Component;

/**
 * {@code #NODE<id>_IF(<expr>)}: substitutes variables, evaluates and jumps to the TRUE or FALSE
 * target. A failing expression counts as false.
 */
@Component
public class ConditionalExecutor implements InstructionExecutor {

    @Override
    public InstructionType supportedType() {
        return InstructionType.CONDITIONAL_START;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        ScriptNode node = ctx.getGraph().conditionalAt(instruction.line())
                .orElseThrow(() -> new IllegalStateException("No conditional block at line " + instruction.line()));

        ctx.setStepCount(ctx.getStepCount() + 1);
        ctx.setCurrentNode(NodeDescriptor.parse(node.getId(), ""));
        ctx.setActionIndex(0);
        ctx.setActionTitle(null);

        String expression = PlaceholderSubstitutor.substitute(node.getExpression(), ctx.getVariables());
        boolean result = ExpressionEvaluator.evaluateBoolean(expression);

        Reference branch = result ? node.getWhenTrue() : node.getWhenFalse();
        Reference resolved = ctx.getGraph().referenceAt(branch.sourceLine()).orElse(branch);
        ctx.log("Node {} condition '{}' is {}, next: {}", node.getId(), expression, result ? "TRUE" : "FALSE", resolved.label());
        return StepOutcome.follow(resolved);
    }
}
