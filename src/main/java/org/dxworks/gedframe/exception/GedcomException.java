package org.dxworks.gedframe.exception;

/**
 * Base type for every failure raised while reading, checking or exporting GEDCOM data.
 */
public class GedcomException extends RuntimeException {

    public GedcomException(String message) {
        super(message);
    }

    public GedcomException(String message, Throwable cause) {
        super(message, cause);
    }
}
