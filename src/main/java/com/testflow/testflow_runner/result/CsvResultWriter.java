package com.testflow.testflow_runner.result;

import com.testflow.testflow_runner.control.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;

/**
 * Writes the whole result table to one CSV file. Each flush goes to a sibling temp file that
 * then replaces the target, so readers never see a half-written file. A target locked by
 * another process (spreadsheet open on it) is retried with a fixed backoff.
 */
@Slf4j
public class CsvResultWriter implements ResultSink {

    /** Seam for the final replace step. */
    @FunctionalInterface
    interface FileReplacer {
        void replace(Path source, Path target) throws IOException;
    }

    private final Path target;
    private final int retries;
    private final Duration backoff;
    private final Sleeper sleeper;
    private final FileReplacer replacer;

    public CsvResultWriter(Path target, int retries, Duration backoff, Sleeper sleeper) {
        this(target, retries, backoff, sleeper, CsvResultWriter::move);
    }

    CsvResultWriter(Path target, int retries, Duration backoff, Sleeper sleeper, FileReplacer replacer) {
        this.target = target;
        this.retries = retries;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.replacer = replacer;
    }

    public Path target() {
        return target;
    }

    @Override
    public void write(ResultTable table) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (List<String> row : table.snapshot()) {
                    writer.write(toCsvLine(row));
                    writer.write("\r\n");
                }
            }
        } catch (IOException e) {
            throw new ResultWriteException("Cannot write " + temp, e);
        }

        for (int attempt = 1; ; attempt++) {
            try {
                replacer.replace(temp, target);
                return;
            } catch (FileSystemException e) {
                if (attempt > retries) {
                    throw new ResultWriteException("Result file " + target + " still locked after " + retries + " retries", e);
                }
                log.warn("Result file {} is locked ({}), retry {}/{} in {} ms",
                        target, e.getClass().getSimpleName(), attempt, retries, backoff.toMillis());
                pause();
            } catch (IOException e) {
                throw new ResultWriteException("Cannot replace " + target, e);
            }
        }
    }

    private void pause() {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResultWriteException("Interrupted while waiting for " + target, e);
        }
    }

    static String toCsvLine(List<String> cells) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(',');
            }
            line.append(escape(cells.get(i)));
        }
        return line.toString();
    }

    // RFC 4180: quote fields holding a separator, quote or line break; double embedded quotes.
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
