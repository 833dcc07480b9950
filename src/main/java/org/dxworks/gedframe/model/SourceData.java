package org.dxworks.gedframe.model;

public class SourceData {
    public String title;
    public String author;
    public String publication;
    public String repository;
    public String text;
}
