package com.testflow.testflow_runner.model.script;

/**
 * A jump target captured from the script. {@code resolvedLine} is null until the
 * {@code ReferenceResolver} found the target, and stays null when it could not.
 */
public record Reference(ReferenceKind kind, int targetId, int sourceLine, Integer resolvedLine) {

    public static Reference node(int nodeId, int sourceLine) {
        return new Reference(ReferenceKind.NODE, nodeId, sourceLine, null);
    }

    public static Reference loopEnd(int loopId, int sourceLine) {
        return new Reference(ReferenceKind.LOOP_END, loopId, sourceLine, null);
    }

    public static Reference line(int line, int sourceLine) {
        return new Reference(ReferenceKind.LINE, -1, sourceLine, line);
    }

    public static Reference terminal(int sourceLine) {
        return new Reference(ReferenceKind.TERMINAL, -1, sourceLine, null);
    }

    /** Parses the {@code N3} / {@code LE2} token form used inside scripts. */
    public static Reference parse(String type, String id, int sourceLine) {
        int target = Integer.parseInt(id.trim());
        return "LE".equalsIgnoreCase(type.trim())
                ? loopEnd(target, sourceLine)
                : node(target, sourceLine);
    }

    public Reference resolvedTo(Integer line) {
        return new Reference(kind, targetId, sourceLine, line);
    }

    public boolean isTerminal() {
        return kind == ReferenceKind.TERMINAL;
    }

    public boolean isResolved() {
        return kind == ReferenceKind.TERMINAL || resolvedLine != null;
    }

    public String label() {
        return switch (kind) {
            case NODE     -> "N" + targetId;
            case LOOP_END -> "LE" + targetId;
            case LINE     -> "line " + resolvedLine;
            case TERMINAL -> "END";
        };
    }
}
