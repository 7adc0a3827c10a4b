package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.NormalizationResult;
import com.lynkvertx.evfeas.model.RawTable;
import com.lynkvertx.evfeas.model.Reading;
import com.lynkvertx.evfeas.model.StructuralError;
import com.lynkvertx.evfeas.util.CellParsing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.lynkvertx.evfeas.util.CellParsing.containsIgnoreCase;

/**
 * Converts a tall table (one row per timestamp) into power readings.
 *
 * The timestamp comes from a {@code timestamp} column or from {@code date} + {@code time}.
 * Power comes from the leftmost column whose label contains "kw"; a "kWh" column placed before
 * a "kW" column wins. Rows with an unparseable timestamp or power value are dropped.
 */
@Slf4j
@Service
public class TallNormalizer {

    public static final String MISSING_TIMESTAMP_MESSAGE = "Missing 'timestamp' or 'date' + 'time' columns.";
    public static final String MISSING_POWER_MESSAGE = "No 'kW' column found.";

    public NormalizationResult normalize(RawTable source) {
        RawTable table = promoteEmbeddedHeader(source);
        List<String> labels = normalizeLabels(table.getHeader());

        int timestampCol = labels.indexOf("timestamp");
        int dateCol = labels.indexOf("date");
        int timeCol = labels.indexOf("time");
        if (timestampCol < 0 && (dateCol < 0 || timeCol < 0)) {
            return NormalizationResult.failure(
                StructuralError.of(StructuralError.Code.MISSING_TIMESTAMP, MISSING_TIMESTAMP_MESSAGE));
        }

        int powerCol = -1;
        for (int i = 0; i < labels.size(); i++) {
            if (labels.get(i).contains("kw")) {
                powerCol = i;
                break;
            }
        }
        if (powerCol < 0) {
            return NormalizationResult.failure(
                StructuralError.of(StructuralError.Code.MISSING_POWER_COLUMN, MISSING_POWER_MESSAGE));
        }

        List<Reading> readings = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            Optional<LocalDateTime> timestamp = timestampCol >= 0
                ? CellParsing.parseTimestamp(table.cell(row, timestampCol))
                : CellParsing.parseTimestamp(table.cell(row, dateCol), table.cell(row, timeCol));
            Optional<BigDecimal> power = CellParsing.parseDecimal(table.cell(row, powerCol));
            if (timestamp.isPresent() && power.isPresent()) {
                readings.add(new Reading(timestamp.get(), power.get()));
            }
        }

        log.debug("Tall table: power column '{}', {} of {} rows valid",
            labels.get(powerCol), readings.size(), table.rowCount());
        return NormalizationResult.success(readings);
    }

    /**
     * Spreadsheet exports sometimes carry a title row, leaving unnamed header cells and the real
     * header in the first data row. Promote it when the first data row holds a "date" cell.
     */
    RawTable promoteEmbeddedHeader(RawTable table) {
        boolean hasUnnamedColumn = table.getHeader().stream().anyMatch(label -> label.trim().isEmpty());
        if (hasUnnamedColumn && table.rowCount() > 0
            && table.getRows().get(0).stream().anyMatch(cell -> containsIgnoreCase(cell, "date"))) {
            return table.promoteRowToHeader(0);
        }
        return table;
    }

    static List<String> normalizeLabels(List<String> header) {
        List<String> labels = new ArrayList<>(header.size());
        for (String label : header) {
            labels.add(label.toLowerCase(Locale.ROOT).trim());
        }
        return labels;
    }
}
