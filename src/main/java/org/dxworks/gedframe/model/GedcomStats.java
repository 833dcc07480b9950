package org.dxworks.gedframe.model;

public class GedcomStats {
    public String head; // "OK" or "None"
    public int individuals;
    public int families;
    public int sources;
    public int objects;
    public int repositories;

    @Override
    public String toString() {
        return "head=" + head
                + ", individuals=" + individuals
                + ", families=" + families
                + ", sources=" + sources
                + ", objects=" + objects
                + ", repositories=" + repositories;
    }
}
