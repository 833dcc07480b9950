package org.dxworks.gedframe.parser;

/**
 * One tokenized, non-blank input line.
 */
public final class GedcomLine {
    private final int level;
    private final String xref;
    private final String tag;
    private final String value;
    private final boolean valueSeparator;
    private final int lineNumber;

    public GedcomLine(int level, String xref, String tag, String value, boolean valueSeparator, int lineNumber) {
        this.level = level;
        this.xref = xref;
        this.tag = tag;
        this.value = value == null ? "" : value;
        this.valueSeparator = valueSeparator;
        this.lineNumber = lineNumber;
    }

    public int getLevel() {
        return level;
    }

    /** Cross-reference id including its {@code @} delimiters, or {@code null}. */
    public String getXref() {
        return xref;
    }

    public String getTag() {
        return tag;
    }

    public String getValue() {
        return value;
    }

    /** Whether a separator followed the tag, even when the value after it is empty. */
    public boolean hasValueSeparator() {
        return valueSeparator;
    }

    /** 1-based position in the source text, blank lines included. */
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String toString() {
        return level + (xref != null ? " " + xref : "") + " " + tag + (value.isEmpty() ? "" : " " + value);
    }
}
