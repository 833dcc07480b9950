package org.dxworks.gedframe.model;

public class MapData {
    public String latitude;
    public String longitude;
}
