package org.dxworks.gedframe.model;

import java.util.ArrayList;
import java.util.List;

public class FamilyData {
    public String husband; // "" when unknown or removed
    public String wife;
    public List<String> children = new ArrayList<>();
    public EventData marriage;
    public EventData divorce;
}
