package org.dxworks.gedframe.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the structured export. Collections are keyed by cross-reference id
 * and keep source order.
 */
public class GedcomDocument {
    public HeadData head; // nullable
    public Map<String, IndividualData> individuals = new LinkedHashMap<>();
    public Map<String, FamilyData> families = new LinkedHashMap<>();
    public Map<String, SourceData> sources = new LinkedHashMap<>();
    public Map<String, ObjectData> objects = new LinkedHashMap<>();
    public Map<String, RepositoryData> repositories = new LinkedHashMap<>();
}
