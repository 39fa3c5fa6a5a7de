package io.agentcron4j.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum OutputType {

    PDF("pdf", "pdf"),
    MARKDOWN("markdown", "md"),
    HTML("html", "html"),
    JSON("json", "json"),
    TEXT("text", "txt");

    private final String value;
    private final String extension;

    OutputType(String value, String extension) {
        this.value = value;
        this.extension = extension;
    }

    /**
     * Configuration name, e.g. {@code "markdown"}.
     */
    public String value() {
        return value;
    }

    /**
     * File extension without the dot.
     */
    public String extension() {
        return extension;
    }

    public static OutputType fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (OutputType t : values()) {
                if (t.value.equals(v)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("output type must be one of: " + names() + ", got: " + value);
    }

    public static String names() {
        return Arrays.stream(values()).map(OutputType::value).collect(Collectors.joining(", "));
    }
}
