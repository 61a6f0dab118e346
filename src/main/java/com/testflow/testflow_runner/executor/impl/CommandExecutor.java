package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.transport.TransportChannel;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code CMD:<text>}, one of:
 * <ul>
 *   <li>{@code wait(<ms>)}: logical delay</li>
 *   <li>{@code save2var ${var}}: copies the last query reply into a variable</li>
 *   <li>text containing '?': query, reply recorded in the action's column</li>
 *   <li>anything else: write</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class CommandExecutor implements InstructionExecutor {

    static final Pattern WAIT      = Pattern.compile("^wait\\s*\\(\\s*(\\d+(?:\\.\\d+)?)\\s*\\)\\s*$", Pattern.CASE_INSENSITIVE);
    static final Pattern SAVE2VAR  = Pattern.compile("^save2var\\s*(?:\\$\\{\\s*([^}]+?)\\s*}|(\\S+))\\s*$", Pattern.CASE_INSENSITIVE);

    private final InstrumentIo io;

    @Override
    public InstructionType supportedType() {
        return InstructionType.COMMAND;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        // the save2var target must be read before ${...} is substituted
        Matcher save = SAVE2VAR.matcher(instruction.payload());
        if (save.matches()) {
            saveReply(save.group(1) != null ? save.group(1) : save.group(2), ctx);
            return StepOutcome.next();
        }

        String text = PlaceholderSubstitutor.substitute(instruction.payload(), ctx.getVariables());
        Matcher wait = WAIT.matcher(text);
        if (wait.matches()) {
            long millis = (long) Double.parseDouble(wait.group(1));
            ctx.log("Waiting {} ms", millis);
            io.settle(Duration.ofMillis(millis));
        } else if (text.contains("?")) {
            io.queryAndRecord(ctx, TransportChannel.VISA, text);
        } else {
            io.write(ctx, TransportChannel.VISA, text);
        }
        return StepOutcome.next();
    }

    private void saveReply(String name, RunContext ctx) {
        if (ctx.getLastReply() == null) {
            ctx.log("save2var {}: no query reply to save", name);
            return;
        }
        ctx.getVariables().assign(name, ctx.getLastReply());
        ctx.log("Saved '{}' into variable {}", ctx.getLastReply(), name);
    }
}
