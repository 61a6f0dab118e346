package com.testflow.testflow_runner.transport;

public enum TransportChannel {
    VISA,
    SERIAL
}
