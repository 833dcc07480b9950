package org.dxworks.gedframe.model;

public class ObjectData {
    public String file;
    public String format;
    public String title;
}
