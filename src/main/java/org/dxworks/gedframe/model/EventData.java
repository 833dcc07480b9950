package org.dxworks.gedframe.model;

public class EventData {
    public DateData date;
    public PlaceData place;
    public String type;
    public String age;
    public String cause;
}
