package org.dxworks.gedframe.export;

import org.dxworks.gedframe.parser.ParseResult;

public interface GedcomExporter {
    String export(ParseResult result, boolean emptyFields);
}
