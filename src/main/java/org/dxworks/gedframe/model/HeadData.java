package org.dxworks.gedframe.model;

public class HeadData {
    public String source;
    public String destination;
    public DateData date;
    public String charset;
    public String gedcomVersion;
    public String submitter;
}
