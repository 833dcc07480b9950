package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomStructure;

/**
 * A level-0 record. Records are referenced from elsewhere by their cross-reference id.
 */
public abstract class GedcomRecord<D> extends GedcomStructure<D> {

    protected GedcomRecord(GedcomElement element) {
        super(element);
    }

    /** Cross-reference id, or an empty string when the record has none. */
    public String getXref() {
        return element.getXref() != null ? element.getXref() : "";
    }
}
