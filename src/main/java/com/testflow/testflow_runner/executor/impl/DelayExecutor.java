package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/** {@code Delay:<value>[,<unit>]} with unit MS (default), S, M or H; any other unit reads as MS. */
@Slf4j
@Component
@RequiredArgsConstructor
public class DelayExecutor implements InstructionExecutor {

    private final InstrumentIo io;

    @Override
    public InstructionType supportedType() {
        return InstructionType.DELAY;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        String text = PlaceholderSubstitutor.substitute(instruction.payload(), ctx.getVariables());
        Duration delay;
        try {
            delay = parse(text);
        } catch (IllegalArgumentException e) {
            ctx.log("Invalid delay '{}': {}", text, e.getMessage());
            return StepOutcome.next();
        }
        ctx.log("Delay {} ms", delay.toMillis());
        io.settle(delay);
        return StepOutcome.next();
    }

    public static Duration parse(String text) {
        String[] parts = text.split(",", 2);
        double value = Double.parseDouble(parts[0].trim());
        if (value < 0) {
            throw new IllegalArgumentException("negative delay");
        }
        String unit = parts.length > 1 ? parts[1].trim().toUpperCase(Locale.ROOT) : "MS";
        double millis = switch (unit) {
            case "", "MS" -> value;
            case "S" -> value * 1_000;
            case "M" -> value * 60_000;
            case "H" -> value * 3_600_000;
            default -> {
                log.warn("Unknown delay unit '{}' in '{}', using milliseconds", unit, text);
                yield value;
            }
        };
        return Duration.ofMillis(Math.round(millis));
    }
}
