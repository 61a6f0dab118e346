package com.testflow.testflow_runner.result;

import com.testflow.testflow_runner.support.RecordingSleeper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvResultWriterTest {

    @TempDir
    Path dir;

    private ResultTable table() {
        ResultTable table = new ResultTable(new ResultSchema(List.of("N", "Id(N1|A1)", "Date", "Time")));
        table.update(1, "N", "1");
        table.update(1, "Id(N1|A1)", "ACME,\"X\" 1");
        return table;
    }

    @Test
    void writesHeaderAndRowsWithCrLf() throws IOException {
        Path target = dir.resolve("Out.csv");
        new CsvResultWriter(target, 3, Duration.ofMillis(10), new RecordingSleeper()).write(table());

        assertThat(Files.readString(target)).isEqualTo(
                "N,Id(N1|A1),Date,Time\r\n"
                        + "1,\"ACME,\"\"X\"\" 1\",,\r\n");
        assertThat(dir.resolve("Out.csv.tmp")).doesNotExist();
    }

    @Test
    void rewritesWholeFileOnEveryFlush() throws IOException {
        Path target = dir.resolve("Out.csv");
        CsvResultWriter writer = new CsvResultWriter(target, 3, Duration.ofMillis(10), new RecordingSleeper());
        ResultTable table = table();
        writer.write(table);
        table.update(2, "N", "2");

        writer.write(table);

        assertThat(Files.readAllLines(target)).hasSize(3);
    }

    @Test
    void retriesWhileTargetIsLocked() throws IOException {
        Path target = dir.resolve("Out.csv");
        RecordingSleeper sleeper = new RecordingSleeper();
        AtomicInteger attempts = new AtomicInteger();
        CsvResultWriter writer = new CsvResultWriter(target, 5, Duration.ofMillis(250), sleeper, (source, destination) -> {
            if (attempts.incrementAndGet() < 3) {
                throw new FileSystemException(destination.toString(), null, "locked");
            }
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        });

        writer.write(table());

        assertThat(attempts).hasValue(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(250), Duration.ofMillis(250));
        assertThat(target).exists();
    }

    @Test
    void givesUpAfterRetries() {
        Path target = dir.resolve("Out.csv");
        RecordingSleeper sleeper = new RecordingSleeper();
        CsvResultWriter writer = new CsvResultWriter(target, 2, Duration.ofMillis(1), sleeper, (source, destination) -> {
            throw new FileSystemException(destination.toString(), null, "locked");
        });

        assertThatThrownBy(() -> writer.write(table()))
                .isInstanceOf(ResultWriteException.class)
                .hasMessageContaining("still locked after 2 retries");
        assertThat(sleeper.sleeps()).hasSize(2);
    }

    @Test
    void escapeQuotesOnlyWhenNeeded() {
        assertThat(CsvResultWriter.escape("plain")).isEqualTo("plain");
        assertThat(CsvResultWriter.escape("a,b")).isEqualTo("\"a,b\"");
        assertThat(CsvResultWriter.escape("line\nbreak")).isEqualTo("\"line\nbreak\"");
        assertThat(CsvResultWriter.escape(null)).isEmpty();
    }
}
