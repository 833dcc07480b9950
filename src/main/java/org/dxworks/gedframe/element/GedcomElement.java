package org.dxworks.gedframe.element;

import org.dxworks.gedframe.parser.GedcomLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Generic node of the parsed tree: one source line plus the lines nested under it.
 * Children are kept in source order and owned by this element only.
 */
public class GedcomElement {
    private final int level;
    private final String xref;
    private final String tag;
    private final String value;
    private final boolean valueSeparator;
    private final List<GedcomElement> children;

    public GedcomElement(int level, String xref, String tag, String value, boolean valueSeparator,
                         List<GedcomElement> children) {
        this.level = level;
        this.xref = xref;
        this.tag = tag;
        this.value = value == null ? "" : value;
        this.valueSeparator = valueSeparator;
        this.children = new ArrayList<>(children);
    }

    /**
     * Builds an element from its own line and the lines below it.
     * A body line at most one level deeper than {@code head} opens a new child, deeper
     * lines go to the child that is currently open. A deeper line with no open child
     * still opens one, so nothing read from the source is dropped.
     */
    public static GedcomElement fromLines(GedcomLine head, List<GedcomLine> body) {
        List<GedcomElement> children = new ArrayList<>();
        GedcomLine childHead = null;
        List<GedcomLine> childBody = new ArrayList<>();

        for (GedcomLine line : body) {
            if (childHead == null || line.getLevel() <= head.getLevel() + 1) {
                if (childHead != null) {
                    children.add(fromLines(childHead, childBody));
                }
                childHead = line;
                childBody = new ArrayList<>();
            } else {
                childBody.add(line);
            }
        }
        if (childHead != null) {
            children.add(fromLines(childHead, childBody));
        }

        return new GedcomElement(head.getLevel(), head.getXref(), head.getTag(), head.getValue(),
                head.hasValueSeparator(), children);
    }

    public int getLevel() {
        return level;
    }

    /** Cross-reference id, or {@code null} when the line carried none. */
    public String getXref() {
        return xref;
    }

    public String getTag() {
        return tag;
    }

    public String getValue() {
        return value;
    }

    /** Whether the source line had a separator after the tag, as in {@code "1 BIRT "}. */
    public boolean hasValueSeparator() {
        return valueSeparator;
    }

    public List<GedcomElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Direct children with the given tag, in source order. Never {@code null}.
     */
    public List<GedcomElement> findSubElements(String tag) {
        return children.stream()
                .filter(child -> child.tag.equals(tag))
                .toList();
    }

    public List<GedcomElement> findSubElements(GedcomTag tag) {
        return findSubElements(tag.name());
    }

    public Optional<GedcomElement> findFirst(GedcomTag tag) {
        return children.stream()
                .filter(child -> tag.matches(child.tag))
                .findFirst();
    }

    public Optional<String> firstValue(GedcomTag tag) {
        return findFirst(tag).map(GedcomElement::getValue);
    }

    /**
     * Detaches every direct child with the given tag and value.
     *
     * @return number of children removed
     */
    public int removeSubElements(GedcomTag tag, String value) {
        int before = children.size();
        children.removeIf(child -> tag.matches(child.tag) && child.value.equals(value));
        return before - children.size();
    }

    @Override
    public String toString() {
        return level + (xref != null ? " " + xref : "") + " " + tag + (value.isEmpty() ? "" : " " + value);
    }
}
