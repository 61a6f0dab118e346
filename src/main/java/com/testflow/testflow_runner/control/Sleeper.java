package com.testflow.testflow_runner.control;

import java.time.Duration;

/** Blocking delay; swapped for a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
