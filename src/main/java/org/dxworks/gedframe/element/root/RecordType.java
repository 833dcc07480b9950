package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomTag;

import java.util.Arrays;
import java.util.Optional;

/**
 * Top-level tags the parser keeps. Anything else at level 0 is skipped.
 */
public enum RecordType {
    HEAD(GedcomTag.HEAD),
    INDIVIDUAL(GedcomTag.INDI),
    FAMILY(GedcomTag.FAM),
    SOURCE(GedcomTag.SOUR),
    OBJECT(GedcomTag.OBJE),
    REPOSITORY(GedcomTag.REPO);

    private final GedcomTag tag;

    RecordType(GedcomTag tag) {
        this.tag = tag;
    }

    public static Optional<RecordType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(type -> type.tag.matches(tag))
                .findFirst();
    }
}
