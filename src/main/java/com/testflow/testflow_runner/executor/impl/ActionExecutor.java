package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.variable.ExpressionEvaluationException;
import com.testflow.testflow_runner.variable.ExpressionEvaluator;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import com.testflow.testflow_runner.variable.ValueFormat;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code #ACTION:(<title>)} opens the next action of the current node. The title {@code Math}
 * additionally consumes the following line as {@code ${var}=<expression>}.
 */
@Component
public class ActionExecutor implements InstructionExecutor {

    static final String MATH = "Math";

    private static final Pattern ASSIGNMENT = Pattern.compile("^(?:CMD\\s*:)?\\s*\\$\\{\\s*([^}]+?)\\s*}\\s*=\\s*(.+)$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public InstructionType supportedType() {
        return InstructionType.ACTION;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        ctx.setActionIndex(ctx.getActionIndex() + 1);
        ctx.setActionTitle(instruction.payload());
        ctx.log("Action {} ({})", ctx.getActionIndex(), instruction.payload());

        if (!MATH.equalsIgnoreCase(instruction.payload().strip())) {
            return StepOutcome.next();
        }
        int next = instruction.line() + 1;
        if (next <= ctx.getGraph().lineCount()) {
            evaluate(ctx.getGraph().instructionAt(next).raw(), next, ctx);
        }
        return StepOutcome.jump(next + 1);
    }

    private void evaluate(String line, int lineNumber, RunContext ctx) {
        Matcher assignment = ASSIGNMENT.matcher(line == null ? "" : line.strip());
        if (!assignment.matches()) {
            ctx.log("Math line {} is not of the form ${var}=expression: {}", lineNumber, line);
            return;
        }
        String target = assignment.group(1);
        if (!ctx.getVariables().contains(target)) {
            ctx.log("Math line {}: unknown variable {}", lineNumber, target);
            return;
        }
        String expression = PlaceholderSubstitutor.substitute(assignment.group(2), ctx.getVariables());
        try {
            Object value = ExpressionEvaluator.evaluate(expression);
            ctx.getVariables().assign(target, value);
            ctx.log("Math: {} = {} = {}", target, expression, ValueFormat.format(value));
        } catch (ExpressionEvaluationException e) {
            ctx.log("Math line {} failed for '{}': {}", lineNumber, expression, e.getMessage());
        }
    }
}
