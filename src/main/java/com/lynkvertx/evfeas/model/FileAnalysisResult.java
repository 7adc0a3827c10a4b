package com.lynkvertx.evfeas.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything computed for a single uploaded file. When {@code error} is set the profile,
 * evaluation and mix are absent and the caller should skip the file.
 */
@Value
@Builder
public class FileAnalysisResult {
    String fileName;
    TableShape shape;
    int readingCount;
    HourlyProfile profile;
    CapacityProfile evaluation;
    @Singular("mixHour")
    List<ChargerMixResult> chargerMix;
    @Singular
    List<DataQualityWarning> warnings;
    StructuralError error;

    public boolean isFailed() {
        return error != null;
    }
}
