package io.agentcron4j.internal.output;

import io.agentcron4j.OutputRenderer;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.core.RenderMetadata;

import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts markup content into a standalone, styled HTML page with a generation footer.
 */
public class HtmlRenderer implements OutputRenderer {

    static final DateTimeFormatter GENERATED_AT =
            DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH);

    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*");
    private static final Pattern CODE = Pattern.compile("`([^`]+)`");

    private static final String STYLE = String.join("\n",
            "        body {",
            "            font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif;",
            "            max-width: 800px;",
            "            margin: 40px auto;",
            "            padding: 20px;",
            "            line-height: 1.6;",
            "        }",
            "        h1, h2, h3 { color: #1a1a1a; }",
            "        code {",
            "            background: #f4f4f4;",
            "            padding: 2px 6px;",
            "            border-radius: 3px;",
            "        }",
            "        footer { color: #666666; margin-top: 40px; }",
            "");

    @Override
    public OutputType type() {
        return OutputType.HTML;
    }

    @Override
    public byte[] render(String content, RenderMetadata metadata) {
        String title = escape(metadata.title());
        StringBuilder html = new StringBuilder(content.length() * 2 + 1024);
        html.append("<!DOCTYPE html>\n")
                .append("<html>\n<head>\n")
                .append("    <meta charset=\"utf-8\">\n")
                .append("    <title>").append(title).append("</title>\n")
                .append("    <style>\n").append(STYLE).append("    </style>\n")
                .append("</head>\n<body>\n")
                .append("    <header><h1 class=\"report-title\">").append(title).append("</h1></header>\n")
                .append("    <div class=\"content\">\n");
        appendBody(html, MarkupLine.parse(content));
        html.append("    </div>\n")
                .append("    <footer>\n")
                .append("        <p><small>Generated on ")
                .append(GENERATED_AT.format(metadata.localTimestamp()))
                .append("</small></p>\n")
                .append("    </footer>\n")
                .append("</body>\n</html>\n");
        return html.toString().getBytes(StandardCharsets.UTF_8);
    }

    private void appendBody(StringBuilder html, List<MarkupLine> lines) {
        boolean inList = false;
        for (MarkupLine line : lines) {
            if (inList && line.kind() != MarkupLine.Kind.BULLET) {
                html.append("        </ul>\n");
                inList = false;
            }
            switch (line.kind()) {
                case HEADING_1 -> element(html, "h1", line.text());
                case HEADING_2 -> element(html, "h2", line.text());
                case HEADING_3 -> element(html, "h3", line.text());
                case BULLET -> {
                    if (!inList) {
                        html.append("        <ul>\n");
                        inList = true;
                    }
                    html.append("    ");
                    element(html, "li", line.text());
                }
                case PARAGRAPH -> element(html, "p", line.text());
                case BLANK -> html.append("        <br>\n");
            }
        }
        if (inList) {
            html.append("        </ul>\n");
        }
    }

    private static void element(StringBuilder html, String tag, String text) {
        html.append("        <").append(tag).append('>')
                .append(inline(text))
                .append("</").append(tag).append(">\n");
    }

    static String inline(String text) {
        String escaped = escape(text);
        escaped = CODE.matcher(escaped).replaceAll("<code>$1</code>");
        return BOLD.matcher(escaped).replaceAll("<strong>$1</strong>");
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
