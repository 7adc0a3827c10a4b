package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.CapacityProfile;
import com.lynkvertx.evfeas.model.ClassifiedTable;
import com.lynkvertx.evfeas.model.EvaluationSettings;
import com.lynkvertx.evfeas.model.FileAnalysisResult;
import com.lynkvertx.evfeas.model.HourlyProfile;
import com.lynkvertx.evfeas.model.NamedTable;
import com.lynkvertx.evfeas.model.NormalizationResult;
import com.lynkvertx.evfeas.model.RawTable;
import com.lynkvertx.evfeas.model.StructuralError;
import com.lynkvertx.evfeas.model.TableShape;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Load Profile Pipeline
 *
 * Runs one table through every step, each depending on the full output of the previous one:
 * 1. Classify the layout (tall or wide), locating an embedded header
 * 2. Normalize into power readings
 * 3. Aggregate to the maximum power per hour-of-day
 * 4. Evaluate against the site capacity
 * 5. Allocate the greedy charger mix (when candidate sizes are given)
 *
 * Each run is a pure function of its table and settings. Batches are processed sequentially and
 * a failing file never stops the files after it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadProfilePipeline {

    public static final String NO_VALID_DATA_MESSAGE = "No valid readings found after parsing timestamps and values.";

    private final ShapeClassifier shapeClassifier;
    private final TallNormalizer tallNormalizer;
    private final WideNormalizer wideNormalizer;
    private final HourlyAggregator hourlyAggregator;
    private final CapacityEvaluator capacityEvaluator;
    private final ChargerMixOptimizer chargerMixOptimizer;

    public FileAnalysisResult analyze(String fileName, RawTable table, EvaluationSettings settings) {
        return analyze(fileName, table, settings, null);
    }

    /**
     * @param layoutOverride layout to use instead of the detected one, or null to detect.
     *                       Header location still runs either way.
     */
    public FileAnalysisResult analyze(String fileName, RawTable table, EvaluationSettings settings,
                                      TableShape layoutOverride) {
        FileAnalysisResult.FileAnalysisResultBuilder result = FileAnalysisResult.builder().fileName(fileName);

        ClassifiedTable classified = shapeClassifier.classify(table);
        TableShape shape = layoutOverride != null ? layoutOverride : classified.getShape();
        result.shape(shape);

        NormalizationResult normalized = shape == TableShape.WIDE
            ? wideNormalizer.normalize(classified.getTable())
            : tallNormalizer.normalize(classified.getTable());

        if (normalized.isFailed()) {
            log.warn("File '{}' ({}): {}", fileName, shape, normalized.getError().getMessage());
            return result.error(normalized.getError()).build();
        }
        result.warnings(normalized.getWarnings()).readingCount(normalized.getReadings().size());

        HourlyProfile profile = hourlyAggregator.aggregate(normalized.getReadings());
        if (profile.isEmpty()) {
            log.warn("File '{}' ({}): no valid readings", fileName, shape);
            return result.error(StructuralError.of(StructuralError.Code.NO_VALID_DATA, NO_VALID_DATA_MESSAGE)).build();
        }
        result.profile(profile);

        CapacityProfile evaluation = capacityEvaluator.evaluate(profile, settings);
        result.evaluation(evaluation);

        if (!settings.getMixSizesKw().isEmpty()) {
            result.chargerMix(chargerMixOptimizer.optimize(evaluation, settings.getMixSizesKw()));
        }

        log.info("File '{}' analysed: shape={}, readings={}, hours={}, overload={}",
            fileName, shape, normalized.getReadings().size(),
            profile.definedHourCount(), evaluation.anyHourExceedsCapacity());
        return result.build();
    }

    /**
     * Analyse several tables one after another. Unexpected failures are captured in the
     * failing file's result.
     *
     * @param settingsFor settings for each file, resolved by the caller (e.g. per-file capacity)
     */
    public List<FileAnalysisResult> analyzeBatch(List<NamedTable> tables,
                                                 Function<String, EvaluationSettings> settingsFor) {
        return analyzeBatch(tables, settingsFor, null);
    }

    public List<FileAnalysisResult> analyzeBatch(List<NamedTable> tables,
                                                 Function<String, EvaluationSettings> settingsFor,
                                                 TableShape layoutOverride) {
        List<FileAnalysisResult> results = new ArrayList<>(tables.size());
        for (NamedTable named : tables) {
            results.add(analyzeIsolated(named, settingsFor, layoutOverride));
        }
        return results;
    }

    private FileAnalysisResult analyzeIsolated(NamedTable named, Function<String, EvaluationSettings> settingsFor,
                                               TableShape layoutOverride) {
        try {
            return analyze(named.getName(), named.getTable(), settingsFor.apply(named.getName()), layoutOverride);
        } catch (RuntimeException e) {
            log.error("Failed to process '{}'", named.getName(), e);
            return failed(named.getName(), StructuralError.Code.PROCESSING_FAILURE,
                "Failed to process " + named.getName() + ": " + e.getMessage());
        }
    }

    public static FileAnalysisResult failed(String fileName, StructuralError.Code code, String message) {
        return FileAnalysisResult.builder()
            .fileName(fileName)
            .error(StructuralError.of(code, message))
            .build();
    }
}
