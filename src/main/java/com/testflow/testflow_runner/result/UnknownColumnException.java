package com.testflow.testflow_runner.result;

import com.testflow.testflow_runner.TestflowException;

public class UnknownColumnException extends TestflowException {

    public UnknownColumnException(String column) {
        super("Unknown result column: " + column);
    }
}
