package org.dxworks.gedframe.element;

import java.util.Optional;

/**
 * A generic element re-read as a specific kind of record. The wrapped element and its
 * children stay as parsed; subclasses compute their fields once, in their constructor.
 *
 * @param <D> export data type returned by {@link #getData()}
 */
public abstract class GedcomStructure<D> {
    protected final GedcomElement element;

    protected GedcomStructure(GedcomElement element) {
        this.element = element;
    }

    public GedcomElement getElement() {
        return element;
    }

    public String getTag() {
        return element.getTag();
    }

    public String getValue() {
        return element.getValue();
    }

    /**
     * Snapshot of the derived fields, ready for structured export.
     */
    public abstract D getData();

    protected Optional<String> firstValue(GedcomTag tag) {
        return element.firstValue(tag);
    }

    protected static <T extends GedcomStructure<R>, R> R dataOrNull(Optional<T> structure) {
        return structure.map(s -> s.getData()).orElse(null);
    }
}
