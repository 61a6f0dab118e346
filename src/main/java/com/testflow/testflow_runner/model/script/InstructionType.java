package com.testflow.testflow_runner.model.script;

public enum InstructionType {
    SCRIPT_START,
    SCRIPT_END,
    NODE_START,
    NODE_END,
    CONDITIONAL_START,
    BRANCH_TRUE,
    BRANCH_FALSE,
    CONDITIONAL_END,
    LOOP_START,
    LOOP_END,
    VARIABLE,
    RANGE,
    WORKFLOW_START,
    WORKFLOW_END,
    WORKFLOW_CALL,
    INSTRUMENT,
    ACTION,
    COMMAND,
    QUERY,
    IMAGE_CAPTURE,
    SET_CAPTURE,
    SERIAL,
    DELAY,
    MESSAGE,
    COMMENT,
    BLANK,
    TEXT;

    /** Lines that delimit a structural element; the walk never treats them as plain body lines. */
    public boolean isStructural() {
        return switch (this) {
            case NODE_START, NODE_END, CONDITIONAL_START, LOOP_START, LOOP_END, SCRIPT_END -> true;
            default -> false;
        };
    }

    /**
     * Lines the walk steps over without doing anything: markers consumed by the parser,
     * range payloads of a {@code Variable:} line, comments and free text.
     */
    public boolean isInert() {
        return switch (this) {
            case SCRIPT_START, BRANCH_TRUE, BRANCH_FALSE, CONDITIONAL_END, RANGE,
                 WORKFLOW_START, WORKFLOW_END, COMMENT, BLANK, TEXT -> true;
            default -> false;
        };
    }

    /** Lines in front of which the engine consults the run state. */
    public boolean opensBody() {
        return this == NODE_START || this == CONDITIONAL_START || this == LOOP_START;
    }
}
