package org.dxworks.gedframe.export;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.root.GedcomRecord;
import org.dxworks.gedframe.parser.ParseResult;

/**
 * Writes the tree back as GEDCOM lines, depth-first, in collection order
 * (head, individuals, families, sources, objects, repositories), closed by {@code 0 TRLR}.
 */
public class GedcomTextExporter implements GedcomExporter {
    private static final String TRAILER = "0 TRLR";
    private static final char NL = '\n';

    @Override
    public String export(ParseResult result, boolean emptyFields) {
        StringBuilder sb = new StringBuilder();
        result.getHead().ifPresent(head -> appendRecord(head, sb));
        result.getIndividuals().forEach(record -> appendRecord(record, sb));
        result.getFamilies().forEach(record -> appendRecord(record, sb));
        result.getSources().forEach(record -> appendRecord(record, sb));
        result.getObjects().forEach(record -> appendRecord(record, sb));
        result.getRepositories().forEach(record -> appendRecord(record, sb));
        sb.append(TRAILER).append(NL);
        return sb.toString();
    }

    private void appendRecord(GedcomRecord<?> record, StringBuilder sb) {
        appendElement(record.getElement(), sb);
    }

    private void appendElement(GedcomElement element, StringBuilder sb) {
        sb.append(element.getLevel()).append(' ');
        if (element.getXref() != null) {
            sb.append(element.getXref()).append(' ');
        }
        sb.append(element.getTag());
        if (element.hasValueSeparator() || !element.getValue().isEmpty()) {
            sb.append(' ').append(element.getValue());
        }
        sb.append(NL);

        for (GedcomElement child : element.getChildren()) {
            appendElement(child, sb);
        }
    }
}
