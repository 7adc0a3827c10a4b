package com.lynkvertx.evfeas.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of normalizing one table: either readings (possibly empty) plus warnings,
 * or a structural error and no readings.
 */
@Value
public class NormalizationResult {
    List<Reading> readings;
    List<DataQualityWarning> warnings;
    StructuralError error;

    public static NormalizationResult success(List<Reading> readings) {
        return new NormalizationResult(Collections.unmodifiableList(readings), Collections.emptyList(), null);
    }

    public static NormalizationResult success(List<Reading> readings, DataQualityWarning warning) {
        return new NormalizationResult(Collections.unmodifiableList(readings), List.of(warning), null);
    }

    public static NormalizationResult failure(StructuralError error) {
        return new NormalizationResult(Collections.emptyList(), Collections.emptyList(), error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
