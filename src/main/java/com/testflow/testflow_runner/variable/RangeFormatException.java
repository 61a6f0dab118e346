package com.testflow.testflow_runner.variable;

import com.testflow.testflow_runner.TestflowException;

public class RangeFormatException extends TestflowException {

    public RangeFormatException(int line, String message) {
        super("Line " + line + ": " + message);
    }
}
