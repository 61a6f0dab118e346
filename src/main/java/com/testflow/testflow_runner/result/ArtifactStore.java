package com.testflow.testflow_runner.result;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Binary captures of one run: {@code image_<row>.<ext>}, then {@code image_<row>(1).<ext>},
 * {@code image_<row>(2).<ext>}... when several captures land in the same row.
 */
public class ArtifactStore {

    private final Path directory;

    public ArtifactStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public synchronized Path store(int row, String extension, byte[] content) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve("image_" + row + "." + extension);
        for (int n = 1; Files.exists(file); n++) {
            file = directory.resolve("image_" + row + "(" + n + ")." + extension);
        }
        return Files.write(file, content);
    }
}
