package org.dxworks.gedframe.exception;

/**
 * Thrown when a line cannot be split into level, tag and value,
 * e.g. when its first token is not a non-negative integer.
 */
public class MalformedLineException extends GedcomException {
    private final int lineNumber;
    private final String line;

    public MalformedLineException(int lineNumber, String line, String reason) {
        super("Malformed line " + lineNumber + " (" + reason + "): " + line);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public MalformedLineException(int lineNumber, String line, String reason, Throwable cause) {
        super("Malformed line " + lineNumber + " (" + reason + "): " + line, cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
