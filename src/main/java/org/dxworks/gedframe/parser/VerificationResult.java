package org.dxworks.gedframe.parser;

import org.dxworks.gedframe.exception.StructuralNestingException;

public final class VerificationResult {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    private final String status;
    private final String message;

    private VerificationResult(String status, String message) {
        this.status = status;
        this.message = message;
    }

    public static VerificationResult ok() {
        return new VerificationResult(STATUS_OK, "");
    }

    public static VerificationResult error(String message) {
        return new VerificationResult(STATUS_ERROR, message);
    }

    public String getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    public void throwIfInvalid() {
        if (!isOk()) {
            throw new StructuralNestingException(message);
        }
    }

    @Override
    public String toString() {
        return isOk() ? status : status + ": " + message;
    }
}
