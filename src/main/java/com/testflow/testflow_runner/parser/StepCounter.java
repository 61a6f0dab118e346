package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.Instruction;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Expected number of node executions, used for progress reporting only: every node start in
 * the window counts once per iteration of each loop around it.
 */
public final class StepCounter {

    private StepCounter() {
    }

    public static long count(List<Instruction> window) {
        Deque<Long> multipliers = new ArrayDeque<>();
        multipliers.push(1L);
        long total = 0;
        for (Instruction instruction : window) {
            switch (instruction.type()) {
                case LOOP_START -> multipliers.push(multipliers.peek() * Math.max(0, instruction.count()));
                case LOOP_END -> {
                    if (multipliers.size() > 1) {
                        multipliers.pop();
                    }
                }
                case NODE_START, CONDITIONAL_START -> total += multipliers.peek();
                default -> { }
            }
        }
        return total;
    }
}
