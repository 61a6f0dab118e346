package com.testflow.testflow_runner.variable;

import com.testflow.testflow_runner.TestflowException;

public class ExpressionEvaluationException extends TestflowException {

    public ExpressionEvaluationException(String message) {
        super(message);
    }
}
