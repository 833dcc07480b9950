package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.element.sub.GedcomEvent;
import org.dxworks.gedframe.model.FamilyData;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A FAM record. Spouse and child fields hold cross-reference ids, not resolved individuals.
 */
public class GedcomFamily extends GedcomRecord<FamilyData> {
    private String husband;
    private String wife;
    private final List<String> children;
    private final GedcomEvent marriage;
    private final GedcomEvent divorce;

    public GedcomFamily(GedcomElement element) {
        super(element);
        this.husband = firstValue(GedcomTag.HUSB).orElse("");
        this.wife = firstValue(GedcomTag.WIFE).orElse("");
        this.children = element.findSubElements(GedcomTag.CHIL).stream()
                .map(GedcomElement::getValue)
                .toList();
        this.marriage = element.findFirst(GedcomTag.MARR).map(GedcomEvent::from).orElse(null);
        this.divorce = element.findFirst(GedcomTag.DIV).map(GedcomEvent::from).orElse(null);
    }

    public String getHusband() {
        return husband;
    }

    public String getWife() {
        return wife;
    }

    /** Non-empty spouse references, husband first. */
    public List<String> getParents() {
        List<String> parents = new ArrayList<>();
        if (!husband.isEmpty()) parents.add(husband);
        if (!wife.isEmpty()) parents.add(wife);
        return parents;
    }

    public List<String> getChildren() {
        return children;
    }

    public Optional<GedcomEvent> getMarriage() {
        return Optional.ofNullable(marriage);
    }

    public Optional<GedcomEvent> getDivorce() {
        return Optional.ofNullable(divorce);
    }

    /**
     * Blanks the husband and/or wife reference equal to {@code xref} and drops the matching
     * HUSB/WIFE line. Children and every other field are left alone.
     *
     * @return true if a spouse reference was cleared
     */
    public boolean clearSpouse(String xref) {
        boolean cleared = false;
        if (!xref.isEmpty() && husband.equals(xref)) {
            husband = "";
            element.removeSubElements(GedcomTag.HUSB, xref);
            cleared = true;
        }
        if (!xref.isEmpty() && wife.equals(xref)) {
            wife = "";
            element.removeSubElements(GedcomTag.WIFE, xref);
            cleared = true;
        }
        return cleared;
    }

    @Override
    public FamilyData getData() {
        FamilyData data = new FamilyData();
        data.husband = husband;
        data.wife = wife;
        data.children = new ArrayList<>(children);
        data.marriage = dataOrNull(getMarriage());
        data.divorce = dataOrNull(getDivorce());
        return data;
    }

    @Override
    public String toString() {
        return "Family " + getXref() + ": " + husband + " + " + wife;
    }
}
