package com.testflow.testflow_runner.engine;

import com.testflow.testflow_runner.model.script.Reference;

/**
 * What the engine does after an instruction: go to the next line, jump, end normally,
 * stop on request, or abort the run as failed.
 */
public record StepOutcome(Kind kind, int line, String message) {

    public enum Kind { NEXT, JUMP, TERMINATE, STOP, ABORT }

    private static final StepOutcome NEXT      = new StepOutcome(Kind.NEXT, -1, null);
    private static final StepOutcome TERMINATE = new StepOutcome(Kind.TERMINATE, -1, null);
    private static final StepOutcome STOP      = new StepOutcome(Kind.STOP, -1, null);

    public static StepOutcome next() {
        return NEXT;
    }

    public static StepOutcome jump(int line) {
        return new StepOutcome(Kind.JUMP, line, null);
    }

    public static StepOutcome terminate() {
        return TERMINATE;
    }

    public static StepOutcome stop() {
        return STOP;
    }

    public static StepOutcome abort(String message) {
        return new StepOutcome(Kind.ABORT, -1, message);
    }

    /** Jump to a resolved reference; an unresolved one aborts the run. */
    public static StepOutcome follow(Reference reference) {
        if (reference.isTerminal()) {
            return TERMINATE;
        }
        if (!reference.isResolved()) {
            return abort("Unresolved jump target " + reference.label() + " taken at line " + reference.sourceLine());
        }
        return jump(reference.resolvedLine());
    }
}
