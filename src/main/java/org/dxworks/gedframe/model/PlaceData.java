package org.dxworks.gedframe.model;

public class PlaceData {
    public String name;
    public String form;
    public MapData map;
}
