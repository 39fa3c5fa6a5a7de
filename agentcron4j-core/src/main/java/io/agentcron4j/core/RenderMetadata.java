package io.agentcron4j.core;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Context passed to renderers alongside the content.
 */
public record RenderMetadata(
        String title,
        Instant timestamp,
        String jobName,
        ZoneId zone
) {
    public ZonedDateTime localTimestamp() {
        return timestamp.atZone(zone);
    }
}
