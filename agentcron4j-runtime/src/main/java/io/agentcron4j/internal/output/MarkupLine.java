package io.agentcron4j.internal.output;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of the lightweight markup agents usually answer in: {@code #}, {@code ##} and
 * {@code ###} headings, {@code -} or {@code *} bullets, blank lines and paragraphs.
 */
record MarkupLine(Kind kind, String text) {

    enum Kind {
        HEADING_1,
        HEADING_2,
        HEADING_3,
        BULLET,
        PARAGRAPH,
        BLANK
    }

    static List<MarkupLine> parse(String content) {
        List<MarkupLine> lines = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return lines;
        }
        for (String raw : content.split("\\R", -1)) {
            lines.add(classify(raw));
        }
        return lines;
    }

    static MarkupLine classify(String raw) {
        String line = raw.stripTrailing();
        if (line.isBlank()) {
            return new MarkupLine(Kind.BLANK, "");
        }
        if (line.startsWith("### ")) {
            return new MarkupLine(Kind.HEADING_3, line.substring(4).trim());
        }
        if (line.startsWith("## ")) {
            return new MarkupLine(Kind.HEADING_2, line.substring(3).trim());
        }
        if (line.startsWith("# ")) {
            return new MarkupLine(Kind.HEADING_1, line.substring(2).trim());
        }
        String stripped = line.stripLeading();
        if (stripped.startsWith("- ") || stripped.startsWith("* ")) {
            return new MarkupLine(Kind.BULLET, stripped.substring(2).trim());
        }
        return new MarkupLine(Kind.PARAGRAPH, line);
    }
}
