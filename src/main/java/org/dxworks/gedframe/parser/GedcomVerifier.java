package org.dxworks.gedframe.parser;

/**
 * Read-only level check over the raw text. Reports the first line that is nested
 * more than one level deeper than the line before it.
 */
public final class GedcomVerifier {

    private GedcomVerifier() {}

    public static VerificationResult verify(String text) {
        String[] rawLines = GedcomLineTokenizer.splitLines(text);
        int currentLevel = 0;
        for (int i = 0; i < rawLines.length; i++) {
            String rawLine = rawLines[i];
            if (GedcomLineTokenizer.isBlank(rawLine)) continue;

            GedcomLine line = GedcomLineTokenizer.tokenize(rawLine, i + 1);
            if (line.getLevel() > currentLevel + 1) {
                return VerificationResult.error("Invalid level on line " + (i + 1) + ": " + stripCarriageReturn(rawLine));
            }
            currentLevel = line.getLevel();
        }
        return VerificationResult.ok();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
