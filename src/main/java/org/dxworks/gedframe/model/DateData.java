package org.dxworks.gedframe.model;

public class DateData {
    public String value; // text as written in the file
    public String day;
    public String month;
    public String year;
}
