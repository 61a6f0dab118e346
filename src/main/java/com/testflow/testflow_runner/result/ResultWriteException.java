package com.testflow.testflow_runner.result;

import com.testflow.testflow_runner.TestflowException;

/** The result file stayed locked for every retry, or could not be written at all. */
public class ResultWriteException extends TestflowException {

    public ResultWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
