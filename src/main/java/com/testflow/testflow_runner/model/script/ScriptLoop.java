package com.testflow.testflow_runner.model.script;

import lombok.Builder;
import lombok.Value;

/**
 * {@code Loop_start(<id>):<iterations>[(N<k>)]} ... {@code Loop_end(<id>)[(N<k>|LE<k>)]}.
 * The iteration counter itself lives in the run's {@code LoopState}, not here.
 */
@Value
@Builder
public class ScriptLoop {
    int id;
    int iterations;
    int startLine;
    int endLine;
    /** Optional body entry taken after the loop header lines ran. */
    Reference entry;
    /** Optional successor taken once the iterations are exhausted. */
    Reference exit;
}
