package org.dxworks.gedframe.exception;

/**
 * Raised on request for a level jump of more than one between consecutive lines.
 * Parsing itself never throws this; see {@code VerificationResult#throwIfInvalid()}.
 */
public class StructuralNestingException extends GedcomException {

    public StructuralNestingException(String message) {
        super(message);
    }
}
