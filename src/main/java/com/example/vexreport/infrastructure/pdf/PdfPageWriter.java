package com.example.vexreport.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.awt.Color;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal flow layout on top of PDFBox: wraps styled text to the page width, starts new pages when the
 * current one is full and draws a running header (title and page number) from the second page on.
 * Not thread-safe; one writer per document.
 */
final class PdfPageWriter implements Closeable {

    static final PDRectangle PAGE_SIZE = PDRectangle.A4;
    static final float MARGIN = 50f;
    private static final float LINE_SPACING = 1.35f;
    private static final float HEADER_FONT_SIZE = 10f;
    private static final Color HEADER_COLOR = new Color(0, 0, 80);

    private final PDDocument document;
    private final String headerTitle;
    private final PDFont headerFont;
    private PDPageContentStream stream;
    private float cursorY;
    private int pageNumber;

    /**
     * Styled font settings for a run of text.
     */
    record TextStyle(PDFont font, float size, Color color) {
    }

    /**
     * Piece of a paragraph drawn with one style.
     */
    record Segment(String text, TextStyle style) {
    }

    private record Placed(String text, TextStyle style, float width) {
    }

    PdfPageWriter(PDDocument document, String headerTitle, PDFont headerFont) throws IOException {
        this.document = document;
        this.headerTitle = headerTitle;
        this.headerFont = headerFont;
        newPage();
    }

    int pageCount() {
        return pageNumber;
    }

	/**
	 * Writes a paragraph made of one or more styled segments, wrapping on word boundaries.
	 *
	 * @param indent   left indentation in points
	 * @param segments text runs in reading order
	 * @throws IOException when PDFBox cannot measure or draw the text
	 */
    void paragraph(float indent, Segment... segments) throws IOException {
        float maxWidth = PAGE_SIZE.getWidth() - 2 * MARGIN - indent;
        for (List<Placed> line : wrap(segments, maxWidth)) {
            float height = lineHeight(line);
            ensureSpace(height);
            cursorY -= height;
            float x = MARGIN + indent;
            int start = 0;
            // one text object per run of equally styled tokens
            while (start < line.size()) {
                TextStyle style = line.get(start).style();
                StringBuilder run = new StringBuilder();
                float runWidth = 0f;
                int end = start;
                while (end < line.size() && line.get(end).style().equals(style)) {
                    run.append(line.get(end).text());
                    runWidth += line.get(end).width();
                    end++;
                }
                drawText(run.toString(), style, x, cursorY);
                x += runWidth;
                start = end;
            }
        }
    }

    void paragraph(float indent, String text, TextStyle style) throws IOException {
        paragraph(indent, new Segment(text, style));
    }

	/**
	 * Writes a single line centered on the page inside a rectangular frame.
	 *
	 * @param text  banner text, expected to fit on one line
	 * @param style banner style
	 * @throws IOException when PDFBox cannot draw the banner
	 */
    void framedBanner(String text, TextStyle style) throws IOException {
        String safe = PdfText.sanitize(style.font(), text);
        float textWidth = PdfText.width(style.font(), style.size(), safe);
        float boxHeight = style.size() * 2.5f;
        ensureSpace(boxHeight + style.size());
        cursorY -= boxHeight;
        float boxWidth = PAGE_SIZE.getWidth() - 2 * MARGIN;
        stream.setStrokingColor(style.color());
        stream.addRect(MARGIN, cursorY, boxWidth, boxHeight);
        stream.stroke();
        float textX = MARGIN + Math.max(0f, (boxWidth - textWidth) / 2f);
        float textY = cursorY + (boxHeight - style.size()) / 2f + style.size() * 0.2f;
        drawText(safe, style, textX, textY);
    }

	/**
	 * Adds vertical space.
	 *
	 * @param points space in points
	 * @throws IOException when a page break is needed and fails
	 */
    void gap(float points) throws IOException {
        if (cursorY - points < MARGIN) {
            newPage();
            return;
        }
        cursorY -= points;
    }

    @Override
    public void close() throws IOException {
        if (stream != null) {
            stream.close();
            stream = null;
        }
    }

    private void ensureSpace(float height) throws IOException {
        if (cursorY - height < MARGIN) {
            newPage();
        }
    }

    private void newPage() throws IOException {
        close();
        PDPage page = new PDPage(PAGE_SIZE);
        document.addPage(page);
        pageNumber++;
        stream = new PDPageContentStream(document, page);
        cursorY = PAGE_SIZE.getHeight() - MARGIN;
        if (pageNumber > 1) {
            drawHeader();
        }
    }

    private void drawHeader() throws IOException {
        TextStyle style = new TextStyle(headerFont, HEADER_FONT_SIZE, HEADER_COLOR);
        float baseline = PAGE_SIZE.getHeight() - MARGIN + HEADER_FONT_SIZE;
        drawText(PdfText.sanitize(headerFont, headerTitle), style, MARGIN, baseline);
        String pageLabel = "Page " + pageNumber;
        float labelWidth = PdfText.width(headerFont, HEADER_FONT_SIZE, pageLabel);
        drawText(pageLabel, style, (PAGE_SIZE.getWidth() - labelWidth) / 2f, baseline - HEADER_FONT_SIZE * LINE_SPACING);
        cursorY -= HEADER_FONT_SIZE * LINE_SPACING * 2;
    }

    private void drawText(String text, TextStyle style, float x, float y) throws IOException {
        if (text.isEmpty()) {
            return;
        }
        stream.beginText();
        stream.setFont(style.font(), style.size());
        stream.setNonStrokingColor(style.color());
        stream.newLineAtOffset(x, y);
        stream.showText(text);
        stream.endText();
    }

    private float lineHeight(List<Placed> line) {
        float size = 0f;
        for (Placed placed : line) {
            size = Math.max(size, placed.style().size());
        }
        return size * LINE_SPACING;
    }

	/**
	 * Splits the segments into lines no wider than {@code maxWidth}. Words longer than a full line are cut.
	 *
	 * @param segments styled runs
	 * @param maxWidth available width in points
	 * @return lines of placed text, at least one
	 * @throws IOException when glyph widths cannot be read
	 */
    private List<List<Placed>> wrap(Segment[] segments, float maxWidth) throws IOException {
        List<List<Placed>> lines = new ArrayList<>();
        List<Placed> current = new ArrayList<>();
        float used = 0f;
        for (Segment segment : segments) {
            if (segment == null || segment.text() == null) {
                continue;
            }
            TextStyle style = segment.style();
            String safe = PdfText.sanitize(style.font(), segment.text());
            for (String token : PdfText.tokens(safe)) {
                float width = PdfText.width(style.font(), style.size(), token);
                if (used + width > maxWidth && !current.isEmpty()) {
                    lines.add(current);
                    current = new ArrayList<>();
                    used = 0f;
                    if (token.isBlank()) {
                        continue;
                    }
                }
                while (width > maxWidth && token.length() > 1) {
                    int fit = PdfText.fittingPrefix(style.font(), style.size(), token, maxWidth);
                    String head = token.substring(0, fit);
                    current.add(new Placed(head, style, PdfText.width(style.font(), style.size(), head)));
                    lines.add(current);
                    current = new ArrayList<>();
                    used = 0f;
                    token = token.substring(fit);
                    width = PdfText.width(style.font(), style.size(), token);
                }
                current.add(new Placed(token, style, width));
                used += width;
            }
        }
        if (!current.isEmpty() || lines.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }
}
