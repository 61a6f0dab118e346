package com.testflow.testflow_runner.control;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.run.RunEnvironment;
import com.testflow.testflow_runner.model.run.RunLog;
import com.testflow.testflow_runner.parser.ScriptParser;
import com.testflow.testflow_runner.support.RecordingSleeper;
import com.testflow.testflow_runner.support.TestEngines;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PauseGateTest {

    private final TestflowProperties properties = new TestflowProperties();
    private final InMemoryRunState state = new InMemoryRunState();
    private final RunLog runLog = new RunLog("gate", TestEngines.CLOCK);

    private RunContext context() {
        return RunContext.builder()
                .graph(new ScriptParser(properties).parse("gate.atoms", "#START_SCRIPT\n#END_SCRIPT"))
                .environment(new RunEnvironment("gate", state, null, runLog, false))
                .build();
    }

    @Test
    void runningPassesWithoutWaiting() {
        RecordingSleeper sleeper = new RecordingSleeper();

        assertThat(new PauseGate(properties, sleeper).awaitRunnable(context())).isTrue();
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void stopEndsTheRun() {
        state.signal(RunSignal.STOP);

        assertThat(new PauseGate(properties, new RecordingSleeper()).awaitRunnable(context())).isFalse();
    }

    @Test
    void resumeIsWrittenBackAsRunning() {
        state.signal(RunSignal.RESUME);

        assertThat(new PauseGate(properties, new RecordingSleeper()).awaitRunnable(context())).isTrue();
        assertThat(state.poll()).isEqualTo(RunSignal.RUNNING);
    }

    @Test
    void pauseTicksUntilResumed() {
        properties.getControl().setPauseTick(Duration.ofMillis(200));
        state.signal(RunSignal.PAUSE);
        RecordingSleeper sleeper = new RecordingSleeper();
        sleeper.onSleep(() -> {
            if (sleeper.sleeps().size() == 3) {
                state.signal(RunSignal.RESUME);
            }
        });

        assertThat(new PauseGate(properties, sleeper).awaitRunnable(context())).isTrue();
        assertThat(sleeper.sleeps()).containsOnly(Duration.ofMillis(200)).hasSize(3);
        assertThat(state.poll()).isEqualTo(RunSignal.RUNNING);
        assertThat(runLog.lines()).anyMatch(line -> line.contains("Test paused"))
                .anyMatch(line -> line.contains("Test resumed"));
    }

    @Test
    void stopWhilePausedEndsTheRun() {
        state.signal(RunSignal.PAUSE);
        RecordingSleeper sleeper = new RecordingSleeper().onSleep(() -> state.signal(RunSignal.STOP));

        assertThat(new PauseGate(properties, sleeper).awaitRunnable(context())).isFalse();
    }

    @Test
    void interruptWhilePausedEndsTheRunAndKeepsFlag() {
        state.signal(RunSignal.PAUSE);
        Sleeper interrupted = duration -> {
            throw new InterruptedException();
        };

        try {
            assertThat(new PauseGate(properties, interrupted).awaitRunnable(context())).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void stopWrittenRightAfterResumeIsKept() {
        RunState racing = new InMemoryRunState() {
            @Override
            public RunSignal poll() {
                RunSignal seen = super.poll();
                if (seen == RunSignal.RESUME) {
                    // the operator writes stop just after the gate has read resume
                    super.signal(RunSignal.STOP);
                }
                return seen;
            }
        };
        racing.signal(RunSignal.RESUME);
        RunContext ctx = RunContext.builder()
                .graph(new ScriptParser(properties).parse("gate.atoms", "#START_SCRIPT\n#END_SCRIPT"))
                .environment(new RunEnvironment("gate", racing, null, runLog, false))
                .build();

        assertThat(new PauseGate(properties, new RecordingSleeper()).awaitRunnable(ctx)).isFalse();
        assertThat(racing.poll()).isEqualTo(RunSignal.STOP);
    }

    @Test
    void compareAndSignalOnlyReplacesTheExpectedToken() {
        state.signal(RunSignal.STOP);

        assertThat(state.compareAndSignal(RunSignal.RESUME, RunSignal.RUNNING)).isFalse();
        assertThat(state.poll()).isEqualTo(RunSignal.STOP);
    }
}
