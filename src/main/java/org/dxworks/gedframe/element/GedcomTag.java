package org.dxworks.gedframe.element;

/**
 * Tags read when deriving record fields. Constant names are the tags as written in the file.
 */
public enum GedcomTag {
    // top-level records
    HEAD, INDI, FAM, SOUR, OBJE, REPO, TRLR,
    // individual
    NAME, SEX, BIRT, DEAT,
    // family
    HUSB, WIFE, CHIL, MARR, DIV,
    // events
    DATE, PLAC, TYPE, AGE, CAUS,
    // places
    FORM, MAP, LATI, LONG,
    // header
    DEST, CHAR, GEDC, VERS, SUBM,
    // sources and objects
    TITL, AUTH, PUBL, TEXT, FILE;

    public boolean matches(String tag) {
        return name().equals(tag);
    }
}
