package org.dxworks.gedframe.exception;

public class UnsupportedFormatException extends GedcomException {

    public UnsupportedFormatException(String format) {
        super("Format " + format + " is not supported.");
    }
}
