package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.AllocationStrategy;
import com.lynkvertx.evfeas.model.CapacityProfile;
import com.lynkvertx.evfeas.model.ChargerMixResult;
import com.lynkvertx.evfeas.model.FileAnalysisResult;
import com.lynkvertx.evfeas.model.HourlyEvaluation;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens analysis results into per-hour record sets with stable column names,
 * and serializes them as CSV.
 */
@Service
public class RecordExportService {

    public static final String HOUR = "Hour";
    public static final String MAX_POWER = "Max_Power_kW";
    public static final String CAPACITY = "Capacity_kW";
    public static final String EXCESS = "Excess_Power_kW";
    public static final String LEVEL2 = "Level2_Chargers";
    public static final String LEVEL3 = "Level3_Chargers";
    public static final String LEVEL2_FIXED = "Level2_Chargers_Fixed";
    public static final String LEVEL3_FIXED = "Level3_Chargers_Fixed";
    public static final String CUSTOM_LOAD = "Custom_Load_kW";
    public static final String TOTAL_LOAD = "Total_Load_kW";
    public static final String EXCEEDS = "Exceeds_Capacity";
    public static final String USED = "Used_kW";
    public static final String REMAINING = "Remaining_kW";

    public List<Map<String, String>> evaluationRecords(CapacityProfile profile) {
        List<Map<String, String>> records = new ArrayList<>();
        for (HourlyEvaluation hour : profile.getHours()) {
            Map<String, String> record = new LinkedHashMap<>();
            record.put(HOUR, String.valueOf(hour.getHour()));
            record.put(MAX_POWER, number(hour.getMaxPowerKw()));
            record.put(CAPACITY, number(hour.getCapacityKw()));
            record.put(EXCESS, number(hour.getExcessKw()));
            switch (profile.getStrategy()) {
                case AUTO:
                    record.put(LEVEL2, String.valueOf(hour.getLevel2Count()));
                    record.put(LEVEL3, String.valueOf(hour.getLevel3Count()));
                    break;
                case FIXED_L3:
                    record.put(LEVEL3_FIXED, String.valueOf(hour.getLevel3Count()));
                    record.put(LEVEL2, String.valueOf(hour.getLevel2Count()));
                    break;
                case FIXED_L2:
                    record.put(LEVEL2_FIXED, String.valueOf(hour.getLevel2Count()));
                    record.put(LEVEL3, String.valueOf(hour.getLevel3Count()));
                    break;
                default:
                    break;
            }
            if (showsAddedLoad(profile)) {
                record.put(CUSTOM_LOAD, number(hour.getCustomLoadKw()));
                record.put(TOTAL_LOAD, number(hour.getTotalLoadKw()));
            }
            record.put(EXCEEDS, String.valueOf(hour.isExceedsCapacity()));
            records.add(record);
        }
        return records;
    }

    public List<Map<String, String>> mixRecords(List<ChargerMixResult> mix) {
        List<Map<String, String>> records = new ArrayList<>();
        for (ChargerMixResult hour : mix) {
            Map<String, String> record = new LinkedHashMap<>();
            record.put(HOUR, String.valueOf(hour.getHour()));
            hour.getCountsByRatingKw().forEach((rating, count) -> record.put(countColumn(rating), String.valueOf(count)));
            record.put(USED, number(hour.getUsedKw()));
            record.put(REMAINING, number(hour.getRemainingKw()));
            records.add(record);
        }
        return records;
    }

    /**
     * Evaluation records of a file, joined per hour with its charger mix columns when present.
     */
    public List<Map<String, String>> analysisRecords(FileAnalysisResult result) {
        if (result.isFailed()) {
            throw new IllegalArgumentException("No records for failed file " + result.getFileName()
                + ": " + result.getError().getMessage());
        }
        List<Map<String, String>> records = evaluationRecords(result.getEvaluation());
        List<Map<String, String>> mix = mixRecords(result.getChargerMix());
        for (int i = 0; i < mix.size(); i++) {
            Map<String, String> mixColumns = new LinkedHashMap<>(mix.get(i));
            mixColumns.remove(HOUR);
            records.get(i).putAll(mixColumns);
        }
        return records;
    }

    /** CSV with a header row taken from the first record's keys; empty input yields an empty string. */
    public String toCsv(List<Map<String, String>> records) {
        if (records.isEmpty()) {
            return "";
        }
        List<String> columns = new ArrayList<>(records.get(0).keySet());
        StringBuilder out = new StringBuilder();
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(columns.toArray(new String[0]))
            .setRecordSeparator("\n")
            .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (Map<String, String> record : records) {
                List<String> values = new ArrayList<>(columns.size());
                for (String column : columns) {
                    values.add(record.getOrDefault(column, ""));
                }
                printer.printRecord(values);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public static String countColumn(BigDecimal ratingKw) {
        return ratingKw.stripTrailingZeros().toPlainString() + "kW_Count";
    }

    private static boolean showsAddedLoad(CapacityProfile profile) {
        return profile.isCustomLoadApplied()
            || profile.getStrategy() == AllocationStrategy.FIXED_L3
            || profile.getStrategy() == AllocationStrategy.FIXED_L2;
    }

    private static String number(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }
}
