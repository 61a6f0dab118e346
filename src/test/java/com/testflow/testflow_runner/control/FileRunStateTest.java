package com.testflow.testflow_runner.control;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileRunStateTest {

    @TempDir
    Path dir;

    @Test
    void missingFileReadsAsRunning() {
        assertThat(new FileRunState(dir.resolve("status.txt")).poll()).isEqualTo(RunSignal.RUNNING);
    }

    @Test
    void readsTokenWrittenByOperator() throws IOException {
        Path file = Files.writeString(dir.resolve("status.txt"), " Pause\n");

        assertThat(new FileRunState(file).poll()).isEqualTo(RunSignal.PAUSE);
    }

    @Test
    void unknownTokenReadsAsRunning() throws IOException {
        Path file = Files.writeString(dir.resolve("status.txt"), "whatever");

        assertThat(new FileRunState(file).poll()).isEqualTo(RunSignal.RUNNING);
    }

    @Test
    void signalWritesLowerCaseTokenAndClearDeletes() throws IOException {
        FileRunState state = new FileRunState(dir.resolve("status.txt"));

        state.signal(RunSignal.STOP);
        assertThat(Files.readString(state.file())).isEqualTo("stop");

        state.clear();
        assertThat(state.file()).doesNotExist();
    }

    @Test
    void compareAndSignalRereadsTheFile() throws IOException {
        FileRunState state = new FileRunState(dir.resolve("status.txt"));
        Files.writeString(state.file(), "stop");

        assertThat(state.compareAndSignal(RunSignal.RESUME, RunSignal.RUNNING)).isFalse();
        assertThat(Files.readString(state.file())).isEqualTo("stop");

        Files.writeString(state.file(), "resume");
        assertThat(state.compareAndSignal(RunSignal.RESUME, RunSignal.RUNNING)).isTrue();
        assertThat(Files.readString(state.file())).isEqualTo("running");
    }
}
