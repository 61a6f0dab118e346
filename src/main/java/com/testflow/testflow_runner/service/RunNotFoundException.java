package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.TestflowException;

public class RunNotFoundException extends TestflowException {

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
