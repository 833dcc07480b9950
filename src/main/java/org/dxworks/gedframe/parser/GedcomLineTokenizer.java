package org.dxworks.gedframe.parser;

import org.dxworks.gedframe.exception.MalformedLineException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw GEDCOM lines into level, optional cross-reference id, tag and value.
 * Level, xref and tag are separated by runs of whitespace. The value is the rest of
 * the line after the single separator that follows the tag, so its interior spacing
 * survives unchanged.
 */
public final class GedcomLineTokenizer {

    private static final String XREF_SIGIL = "@";
    private static final Pattern TOKEN = Pattern.compile("\\S+");
    private static final Pattern LEVEL = Pattern.compile("\\d+");
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private GedcomLineTokenizer() {}

    /**
     * A line with a level but no tag yields an empty tag.
     *
     * @throws MalformedLineException if the first token is not a non-negative integer
     */
    public static GedcomLine tokenize(String rawLine, int lineNumber) {
        String line = stripCarriageReturn(rawLine);
        Matcher token = TOKEN.matcher(line);

        int level = parseLevel(token.find() ? token.group() : "", line, lineNumber);

        String xref = null;
        String tag = "";
        int tagEnd = -1;
        if (token.find()) {
            if (token.group().startsWith(XREF_SIGIL)) {
                xref = token.group();
                if (token.find()) {
                    tag = token.group();
                    tagEnd = token.end();
                }
            } else {
                tag = token.group();
                tagEnd = token.end();
            }
        }

        boolean valueSeparator = tagEnd >= 0 && tagEnd < line.length();
        String value = valueSeparator ? line.substring(tagEnd + 1) : "";
        return new GedcomLine(level, xref, tag, value, valueSeparator, lineNumber);
    }

    /**
     * Tokenizes every non-blank line of {@code text}. Line numbers count blank lines too.
     */
    public static List<GedcomLine> tokenizeAll(String text) {
        List<GedcomLine> lines = new ArrayList<>();
        String[] rawLines = splitLines(text);
        for (int i = 0; i < rawLines.length; i++) {
            if (isBlank(rawLines[i])) continue;
            lines.add(tokenize(rawLines[i], i + 1));
        }
        return lines;
    }

    static String[] splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return new String[0];
        }
        return LINE_BREAK.split(text, -1);
    }

    static boolean isBlank(String line) {
        return line == null || line.isBlank();
    }

    private static int parseLevel(String token, String line, int lineNumber) {
        if (!LEVEL.matcher(token).matches()) {
            throw new MalformedLineException(lineNumber, line, "level is not a non-negative integer");
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new MalformedLineException(lineNumber, line, "level out of range", e);
        }
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
