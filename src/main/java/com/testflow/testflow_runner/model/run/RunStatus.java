package com.testflow.testflow_runner.model.run;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    STOPPED,
    FAILED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
