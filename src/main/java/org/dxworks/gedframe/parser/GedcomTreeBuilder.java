package org.dxworks.gedframe.parser;

import org.dxworks.gedframe.element.GedcomElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups a flat line stream into top-level element trees.
 * The first line and every later level-0 line open a new group; all other lines
 * belong to the open group and are nested by {@link GedcomElement#fromLines}.
 * Nesting is not validated here, see {@link GedcomVerifier}.
 */
public final class GedcomTreeBuilder {

    private GedcomTreeBuilder() {}

    public static List<GedcomElement> build(List<GedcomLine> lines) {
        List<GedcomElement> roots = new ArrayList<>();
        GedcomLine current = null;
        List<GedcomLine> body = new ArrayList<>();

        for (GedcomLine line : lines) {
            if (current == null) {
                current = line;
            } else if (line.getLevel() > 0) {
                body.add(line);
            } else {
                roots.add(GedcomElement.fromLines(current, body));
                current = line;
                body = new ArrayList<>();
            }
        }

        if (current != null) {
            roots.add(GedcomElement.fromLines(current, body));
        }
        return roots;
    }
}
