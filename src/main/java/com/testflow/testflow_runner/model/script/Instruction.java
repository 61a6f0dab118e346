package com.testflow.testflow_runner.model.script;

/**
 * One lexed script line.
 *
 * <ul>
 *   <li>{@code payload}: the text after the line's prefix (command text, node descriptor,
 *       expression, variable name, workflow name...)</li>
 *   <li>{@code id}: node or loop id for structural lines, -1 otherwise</li>
 *   <li>{@code count}: declared iterations for loop starts, -1 otherwise</li>
 *   <li>{@code reference}: inline jump target, null when the line carries none</li>
 * </ul>
 */
public record Instruction(int line,
                          InstructionType type,
                          String raw,
                          String payload,
                          int id,
                          int count,
                          Reference reference) {

    public static Instruction of(int line, InstructionType type, String raw, String payload) {
        return new Instruction(line, type, raw, payload, -1, -1, null);
    }

    public static Instruction structural(int line, InstructionType type, String raw, String payload,
                                         int id, int count, Reference reference) {
        return new Instruction(line, type, raw, payload, id, count, reference);
    }

    public boolean hasReference() {
        return reference != null;
    }
}
