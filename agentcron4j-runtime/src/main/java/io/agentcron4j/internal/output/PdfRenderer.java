package io.agentcron4j.internal.output;

import io.agentcron4j.OutputRenderer;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.core.RenderMetadata;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.GregorianCalendar;
import java.util.List;

/**
 * Letter-sized PDF: a title page with the report title and generation time, followed by the
 * content as word-wrapped, paginated text. Headings and bullets of the markup are honoured.
 *
 * <p>Uses the standard Helvetica fonts, so characters outside WinAnsi are replaced by {@code ?}.
 */
public class PdfRenderer implements OutputRenderer {

    private static final float MARGIN = 72f;
    private static final float BOTTOM_MARGIN = 54f;
    private static final float TITLE_SIZE = 24f;
    private static final float BODY_SIZE = 11f;
    private static final float LEADING = 1.4f;
    private static final String BULLET_PREFIX = "- ";

    @Override
    public OutputType type() {
        return OutputType.PDF;
    }

    @Override
    public byte[] render(String content, RenderMetadata metadata) throws IOException {
        PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDDocumentInformation info = doc.getDocumentInformation();
            info.setTitle(metadata.title());
            info.setCreator("agentcron4j");
            info.setCreationDate(GregorianCalendar.from(metadata.localTimestamp()));

            try (PageWriter writer = new PageWriter(doc)) {
                writer.newPage();
                writer.skip(TITLE_SIZE * 2);
                writer.paragraph(bold, TITLE_SIZE, metadata.title(), 0f);
                writer.skip(BODY_SIZE);
                writer.paragraph(regular, BODY_SIZE,
                        "Generated: " + HtmlRenderer.GENERATED_AT.format(metadata.localTimestamp()), 0f);

                List<MarkupLine> lines = MarkupLine.parse(content);
                if (!lines.isEmpty()) {
                    writer.newPage();
                }
                for (MarkupLine line : lines) {
                    switch (line.kind()) {
                        case HEADING_1 -> heading(writer, bold, 18f, line.text());
                        case HEADING_2 -> heading(writer, bold, 15f, line.text());
                        case HEADING_3 -> heading(writer, bold, 13f, line.text());
                        case BULLET -> writer.paragraph(regular, BODY_SIZE, BULLET_PREFIX + line.text(),
                                regular.getStringWidth(BULLET_PREFIX) / 1000f * BODY_SIZE);
                        case PARAGRAPH -> writer.paragraph(regular, BODY_SIZE, line.text(), 0f);
                        case BLANK -> writer.skip(BODY_SIZE);
                    }
                }
            }

            doc.save(out);
            return out.toByteArray();
        }
    }

    private static void heading(PageWriter writer, PDFont font, float size, String text) throws IOException {
        writer.skip(size * 0.5f);
        writer.paragraph(font, size, text, 0f);
    }

    /**
     * Lays out lines top to bottom, opening a new page when the current one is full.
     */
    private static final class PageWriter implements AutoCloseable {
        private final PDDocument doc;
        private final float width = PDRectangle.LETTER.getWidth() - 2 * MARGIN;
        private PDPageContentStream stream;
        private float y;

        private PageWriter(PDDocument doc) {
            this.doc = doc;
        }

        void newPage() throws IOException {
            close();
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            stream = new PDPageContentStream(doc, page);
            y = PDRectangle.LETTER.getHeight() - MARGIN;
        }

        void skip(float amount) throws IOException {
            y -= amount;
            if (y < BOTTOM_MARGIN) {
                newPage();
            }
        }

        /**
         * Writes text wrapped to the page width; continuation lines are indented by {@code hangingIndent}.
         */
        void paragraph(PDFont font, float size, String text, float hangingIndent) throws IOException {
            List<String> wrapped = wrap(font, size, sanitize(font, text), hangingIndent);
            for (int i = 0; i < wrapped.size(); i++) {
                float lineHeight = size * LEADING;
                if (y - lineHeight < BOTTOM_MARGIN) {
                    newPage();
                }
                y -= lineHeight;
                stream.beginText();
                stream.setFont(font, size);
                stream.newLineAtOffset(MARGIN + (i == 0 ? 0f : hangingIndent), y);
                stream.showText(wrapped.get(i));
                stream.endText();
            }
        }

        private List<String> wrap(PDFont font, float size, String text, float hangingIndent) throws IOException {
            List<String> lines = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            float available = width;
            for (String word : text.split(" +")) {
                if (word.isEmpty()) {
                    continue;
                }
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (textWidth(font, size, candidate) <= available) {
                    current.setLength(0);
                    current.append(candidate);
                    continue;
                }
                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                    available = width - hangingIndent;
                }
                // a single word wider than the line is broken by character
                while (textWidth(font, size, word) > available) {
                    int cut = fit(font, size, word, available);
                    lines.add(word.substring(0, cut));
                    word = word.substring(cut);
                    available = width - hangingIndent;
                }
                current.append(word);
            }
            if (current.length() > 0 || lines.isEmpty()) {
                lines.add(current.toString());
            }
            return lines;
        }

        private static int fit(PDFont font, float size, String word, float available) throws IOException {
            int cut = 1;
            while (cut < word.length() && textWidth(font, size, word.substring(0, cut + 1)) <= available) {
                cut++;
            }
            return cut;
        }

        private static float textWidth(PDFont font, float size, String text) throws IOException {
            return font.getStringWidth(text) / 1000f * size;
        }

        private static String sanitize(PDFont font, String text) {
            StringBuilder sb = new StringBuilder(text.length());
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '\t') {
                    sb.append("    ");
                    continue;
                }
                if (Character.isISOControl(c)) {
                    continue;
                }
                String s = String.valueOf(c);
                try {
                    font.encode(s);
                    sb.append(c);
                } catch (IllegalArgumentException | IOException e) {
                    sb.append('?');
                }
            }
            return sb.toString();
        }

        @Override
        public void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }
    }
}
