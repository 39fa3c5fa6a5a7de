package io.agentcron4j.internal.output;

import io.agentcron4j.OutputRenderer;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.core.RenderMetadata;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes the content verbatim as UTF-8. Used for {@code text} and {@code markdown}.
 */
public class TextRenderer implements OutputRenderer {

    private final OutputType type;

    public TextRenderer(OutputType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    @Override
    public OutputType type() {
        return type;
    }

    @Override
    public byte[] render(String content, RenderMetadata metadata) {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
