package com.lynkvertx.evfeas.model;

import lombok.Value;

/**
 * A file-level problem that prevents building a profile.
 * Reported as a value so the caller can skip the file and continue with the batch.
 */
@Value
public class StructuralError {

    public enum Code {
        MISSING_TIMESTAMP,
        MISSING_POWER_COLUMN,
        NO_TIME_AXIS,
        NO_VALID_DATA,
        UNREADABLE_FILE,
        PROCESSING_FAILURE
    }

    Code code;
    String message;

    public static StructuralError of(Code code, String message) {
        return new StructuralError(code, message);
    }
}
