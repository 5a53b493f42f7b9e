package com.example.vexreport.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers for the standard PDF fonts: glyph-safe strings, measuring and word tokenizing.
 */
final class PdfText {

    private static final char REPLACEMENT = '?';

    private PdfText() {
    }

	/**
	 * Replaces characters the font cannot encode with {@code '?'} and control characters with spaces.
	 *
	 * @param font target font
	 * @param text raw text, may be {@code null}
	 * @return printable text, empty for {@code null}
	 */
    static String sanitize(PDFont font, String text) {
        if (text == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length());
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            offset += Character.charCount(codePoint);
            if (Character.isISOControl(codePoint)) {
                builder.append(' ');
                continue;
            }
            String glyph = new String(Character.toChars(codePoint));
            if (canEncode(font, glyph)) {
                builder.append(glyph);
            } else {
                builder.append(REPLACEMENT);
            }
        }
        return builder.toString();
    }

    static float width(PDFont font, float size, String text) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

	/**
	 * Splits text into alternating word and whitespace tokens so wrapping can break between words.
	 *
	 * @param text sanitized text
	 * @return tokens in order, joined they equal {@code text}
	 */
    static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= text.length(); i++) {
            boolean boundary = i == text.length()
                    || Character.isWhitespace(text.charAt(i)) != Character.isWhitespace(text.charAt(i - 1));
            if (boundary) {
                tokens.add(text.substring(start, i));
                start = i;
            }
        }
        return tokens;
    }

	/**
	 * Finds how many leading characters of {@code token} fit into {@code maxWidth}.
	 *
	 * @return prefix length, at least 1
	 */
    static int fittingPrefix(PDFont font, float size, String token, float maxWidth) throws IOException {
        int fit = 1;
        while (fit < token.length() && width(font, size, token.substring(0, fit + 1)) <= maxWidth) {
            fit++;
        }
        return fit;
    }

    private static boolean canEncode(PDFont font, String glyph) {
        try {
            font.encode(glyph);
            return true;
        } catch (IllegalArgumentException | IOException ex) {
            return false;
        }
    }
}
