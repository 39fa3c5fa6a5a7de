package io.agentcron4j.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how a job's result is written.
 *
 * @param type      output format
 * @param directory destination directory, created on first write
 * @param filename  base filename without extension; job name when null
 * @param title     report title for pdf/html/json; a default is used when null
 */
public record OutputConfig(
        OutputType type,
        Path directory,
        String filename,
        String title
) {
    public static final Path DEFAULT_DIRECTORY = Path.of("output");

    public OutputConfig {
        Objects.requireNonNull(type, "output type must not be null");
        directory = directory == null ? DEFAULT_DIRECTORY : directory;
        filename = (filename == null || filename.isBlank()) ? null : filename.trim();
        title = (title == null || title.isBlank()) ? null : title.trim();
    }

    public static OutputConfig of(OutputType type, String directory) {
        return new OutputConfig(type, directory == null ? null : Path.of(directory), null, null);
    }
}
