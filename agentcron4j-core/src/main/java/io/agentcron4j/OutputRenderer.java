package io.agentcron4j;

import io.agentcron4j.core.OutputType;
import io.agentcron4j.core.RenderMetadata;

import java.io.IOException;

public interface OutputRenderer {

    OutputType type();

    byte[] render(String content, RenderMetadata metadata) throws IOException;
}
