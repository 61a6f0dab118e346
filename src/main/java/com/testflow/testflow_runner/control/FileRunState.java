package com.testflow.testflow_runner.control;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Run state kept in a small text file ({@code status.txt}) inside the run directory so an
 * operator, or another process, can pause or stop a run by editing it.
 */
@Slf4j
public class FileRunState implements RunState {

    private final Path file;

    public FileRunState(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    @Override
    public RunSignal poll() {
        try {
            return RunSignal.fromText(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return RunSignal.RUNNING;
        } catch (IOException e) {
            // a writer may hold the file for a moment; treat as unchanged
            log.warn("Cannot read run state {}: {}", file, e.getMessage());
            return RunSignal.RUNNING;
        }
    }

    @Override
    public synchronized void signal(RunSignal signal) {
        try {
            Files.writeString(file, signal.text(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write run state " + file, e);
        }
    }

    /** Re-reads the file right before writing; an operator edit in the same instant can still win. */
    @Override
    public synchronized boolean compareAndSignal(RunSignal expected, RunSignal replacement) {
        if (poll() != expected) {
            return false;
        }
        signal(replacement);
        return true;
    }

    @Override
    public void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Cannot delete run state {}: {}", file, e.getMessage());
        }
    }
}
