package io.agentcron4j.core;

import java.nio.file.Path;

public record OutputArtifact(
        Path path,
        OutputType type,
        long size
) {
}
