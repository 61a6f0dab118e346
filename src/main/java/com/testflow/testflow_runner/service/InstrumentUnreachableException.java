package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.TestflowException;

import java.util.List;

public class InstrumentUnreachableException extends TestflowException {

    public InstrumentUnreachableException(List<String> addresses) {
        super("Instruments not reachable: " + String.join(", ", addresses));
    }
}
