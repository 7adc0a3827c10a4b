package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.config.AnalysisDefaultsConfig;
import com.lynkvertx.evfeas.dto.AnalysisRequestDTO;
import com.lynkvertx.evfeas.dto.BatchAnalysisResultDTO;
import com.lynkvertx.evfeas.dto.ChargerMixRequestDTO;
import com.lynkvertx.evfeas.dto.ChargerMixResultDTO;
import com.lynkvertx.evfeas.dto.CustomChargerDTO;
import com.lynkvertx.evfeas.dto.FileAnalysisDTO;
import com.lynkvertx.evfeas.model.AllocationStrategy;
import com.lynkvertx.evfeas.model.ChargerMixResult;
import com.lynkvertx.evfeas.model.ChargerSpec;
import com.lynkvertx.evfeas.model.DataQualityWarning;
import com.lynkvertx.evfeas.model.EvaluationSettings;
import com.lynkvertx.evfeas.model.FileAnalysisResult;
import com.lynkvertx.evfeas.model.NamedTable;
import com.lynkvertx.evfeas.model.StructuralError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Feasibility Analysis Service
 *
 * Bridges uploads and request parameters to the load profile pipeline:
 * decodes each file, resolves its evaluation settings from the request and the configured
 * defaults, runs the pipeline and maps the result into response DTOs.
 * Files are independent; an unreadable file is reported and the rest are still analysed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeasibilityAnalysisService {

    private final TableReaderService tableReader;
    private final LoadProfilePipeline pipeline;
    private final ChargerMixOptimizer chargerMixOptimizer;
    private final RecordExportService recordExport;
    private final AnalysisDefaultsConfig defaults;

    public BatchAnalysisResultDTO analyze(List<MultipartFile> files, AnalysisRequestDTO request) {
        checkCustomChargerLimit(request);

        List<FileAnalysisDTO> results = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            String fileName = file.getOriginalFilename();
            NamedTable table;
            try {
                table = new NamedTable(fileName, tableReader.read(fileName, file.getBytes()));
            } catch (TableReadException | IOException e) {
                log.warn("Skipping unreadable file '{}': {}", fileName, e.getMessage());
                results.add(toDto(LoadProfilePipeline.failed(fileName, StructuralError.Code.UNREADABLE_FILE,
                    e.getMessage())));
                continue;
            }
            List<FileAnalysisResult> analysed = pipeline.analyzeBatch(List.of(table),
                name -> settingsFor(request, name), request.getLayout());
            results.add(toDto(analysed.get(0)));
        }

        int failed = (int) results.stream().filter(r -> "ERROR".equals(r.getStatus())).count();
        log.info("Analysed {} file(s), {} failed", results.size(), failed);
        return BatchAnalysisResultDTO.builder()
            .files(results)
            .analysedCount(results.size() - failed)
            .failedCount(failed)
            .build();
    }

    /**
     * Analyse one file and serialize its per-hour records as CSV.
     *
     * @throws IllegalArgumentException when the file has a structural error
     */
    public String exportCsv(MultipartFile file, AnalysisRequestDTO request) throws IOException {
        checkCustomChargerLimit(request);
        String fileName = file.getOriginalFilename();
        FileAnalysisResult result = pipeline.analyze(fileName,
            tableReader.read(fileName, file.getBytes()), settingsFor(request, fileName), request.getLayout());
        return recordExport.toCsv(recordExport.analysisRecords(result));
    }

    public ChargerMixResultDTO chargerMix(ChargerMixRequestDTO request) {
        for (Map.Entry<Integer, BigDecimal> entry : request.getExcessByHour().entrySet()) {
            Integer hour = entry.getKey();
            if (hour == null || hour < 0 || hour > 23) {
                throw new IllegalArgumentException("Hour must be between 0 and 23: " + hour);
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Headroom missing for hour " + hour);
            }
        }
        List<ChargerMixResult> mix = chargerMixOptimizer.optimize(
            new TreeMap<>(request.getExcessByHour()), request.getRatingsKw());
        return mixDto(mix);
    }

    /**
     * Settings for one file: per-file capacity override, then request capacity, then default.
     */
    EvaluationSettings settingsFor(AnalysisRequestDTO request, String fileName) {
        BigDecimal capacity = request.getCapacityByFile() != null && request.getCapacityByFile().get(fileName) != null
            ? request.getCapacityByFile().get(fileName)
            : request.getCapacityKw() != null ? request.getCapacityKw() : defaults.getDefaultCapacityKw();

        EvaluationSettings.EvaluationSettingsBuilder settings = EvaluationSettings.builder()
            .capacityKw(capacity)
            .level2Kw(request.getLevel2Kw() != null ? request.getLevel2Kw() : defaults.getLevel2ChargerPowerKw())
            .level3Kw(request.getLevel3Kw() != null ? request.getLevel3Kw() : defaults.getLevel3ChargerPowerKw())
            .strategy(request.getStrategy() != null ? request.getStrategy() : AllocationStrategy.AUTO)
            .fixedCount(request.getFixedCount());

        if (request.isChargerMix()) {
            List<BigDecimal> sizes = request.getMixSizesKw() == null || request.getMixSizesKw().isEmpty()
                ? defaults.getDefaultMixSizesKw()
                : request.getMixSizesKw();
            settings.mixSizesKw(sizes);
        }
        if (request.getCustomChargers() != null) {
            for (CustomChargerDTO charger : request.getCustomChargers()) {
                settings.customCharger(new ChargerSpec(charger.getName(), charger.getPowerKw(), charger.getQuantity()));
            }
        }
        return settings.build();
    }

    private void checkCustomChargerLimit(AnalysisRequestDTO request) {
        if (request.getCustomChargers() != null
            && request.getCustomChargers().size() > defaults.getMaxCustomChargerTypes()) {
            throw new IllegalArgumentException("At most " + defaults.getMaxCustomChargerTypes()
                + " custom charger types are supported");
        }
    }

    FileAnalysisDTO toDto(FileAnalysisResult result) {
        FileAnalysisDTO.FileAnalysisDTOBuilder dto = FileAnalysisDTO.builder()
            .fileName(result.getFileName())
            .shape(result.getShape() != null ? result.getShape().name() : null);

        if (result.isFailed()) {
            return dto.status("ERROR")
                .errorCode(result.getError().getCode().name())
                .errorMessage(result.getError().getMessage())
                .build();
        }

        List<FileAnalysisDTO.HourlyPowerPoint> points = result.getProfile().definedHours().entrySet().stream()
            .map(e -> new FileAnalysisDTO.HourlyPowerPoint(e.getKey(), e.getValue()))
            .collect(Collectors.toList());

        dto.status("OK")
            .readingCount(result.getReadingCount())
            .warnings(result.getWarnings().isEmpty() ? null
                : result.getWarnings().stream().map(DataQualityWarning::getMessage).collect(Collectors.toList()))
            .hourlyProfile(points)
            .peakPowerKw(result.getProfile().peakPowerKw().orElse(null))
            .capacityKw(result.getEvaluation().getCapacityKw())
            .strategy(result.getEvaluation().getStrategy().name())
            .exceedsCapacity(result.getEvaluation().anyHourExceedsCapacity())
            .evaluation(recordExport.evaluationRecords(result.getEvaluation()));

        if (!result.getChargerMix().isEmpty()) {
            dto.chargerMix(mixDto(result.getChargerMix()));
        }
        return dto.build();
    }

    private ChargerMixResultDTO mixDto(List<ChargerMixResult> mix) {
        List<Map<String, String>> records = recordExport.mixRecords(mix);
        return ChargerMixResultDTO.builder()
            .label(ChargerMixOptimizer.ALLOCATION_LABEL)
            .records(records)
            .build();
    }
}
