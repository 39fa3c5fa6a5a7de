package io.agentcron4j.internal.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.agentcron4j.OutputRenderer;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.core.RenderMetadata;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * {@code {"job", "title", "timestamp", "content"}}, pretty printed.
 */
public class JsonRenderer implements OutputRenderer {

    record Report(String job, String title, OffsetDateTime timestamp, String content) {
    }

    private final ObjectMapper objectMapper;

    public JsonRenderer(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public OutputType type() {
        return OutputType.JSON;
    }

    @Override
    public byte[] render(String content, RenderMetadata metadata) throws IOException {
        Report report = new Report(
                metadata.jobName(),
                metadata.title(),
                metadata.localTimestamp().toOffsetDateTime(),
                content
        );
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to serialize report for job " + metadata.jobName(), e);
        }
    }
}
