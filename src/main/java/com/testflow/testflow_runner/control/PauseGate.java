package com.testflow.testflow_runner.control;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.model.run.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Suspension point of the engine. Returns once the run may continue; a pause is held on a
 * fixed tick until resume (written back as running) or stop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PauseGate {

    private final TestflowProperties properties;
    private final Sleeper sleeper;

    /** @return false when the run must stop */
    public boolean awaitRunnable(RunContext ctx) {
        RunState state = ctx.getEnvironment().runState();
        RunSignal signal = state.poll();
        if (signal == RunSignal.STOP) {
            return false;
        }
        if (signal == RunSignal.RESUME) {
            return acknowledgeResume(state);
        }
        if (signal != RunSignal.PAUSE) {
            return true;
        }

        ctx.log("Test paused, waiting for resume or stop");
        while (true) {
            try {
                sleeper.sleep(properties.getControl().getPauseTick());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Run {} interrupted while paused", ctx.getEnvironment().runId());
                return false;
            }
            signal = state.poll();
            if (signal == RunSignal.STOP) {
                return false;
            }
            if (signal == RunSignal.RESUME || signal == RunSignal.RUNNING) {
                if (signal == RunSignal.RESUME && !acknowledgeResume(state)) {
                    return false;
                }
                ctx.log("Test resumed");
                return true;
            }
        }
    }

    /** Turns resume back into running; false when a stop replaced the resume meanwhile. */
    private static boolean acknowledgeResume(RunState state) {
        if (state.compareAndSignal(RunSignal.RESUME, RunSignal.RUNNING)) {
            return true;
        }
        return state.poll() != RunSignal.STOP;
    }
}
