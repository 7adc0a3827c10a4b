package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.DataQualityWarning;
import com.lynkvertx.evfeas.model.NormalizationResult;
import com.lynkvertx.evfeas.model.RawTable;
import com.lynkvertx.evfeas.model.Reading;
import com.lynkvertx.evfeas.model.StructuralError;
import com.lynkvertx.evfeas.util.CellParsing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.lynkvertx.evfeas.util.CellParsing.containsIgnoreCase;

/**
 * Converts a wide table (one row per day) into power readings.
 *
 * Intraday columns (labels containing ":") hold energy in kWh per slot. The slot length is
 * inferred from the column count: 15 minutes for {@value #QUARTER_HOUR_MIN_COLUMNS} or more
 * columns, one hour otherwise. Power = energy / slot length in hours.
 *
 * Without intraday columns, a daily total column ("total" or "kwh" in the label) is spread
 * uniformly over 24 hours. This loses the daily shape, so a {@link DataQualityWarning} is attached.
 */
@Slf4j
@Service
public class WideNormalizer {

    public static final int QUARTER_HOUR_MIN_COLUMNS = 96;

    public static final BigDecimal QUARTER_HOUR = new BigDecimal("0.25");
    public static final BigDecimal ONE_HOUR = BigDecimal.ONE;

    public static final String DAILY_TOTAL_WARNING = "Daily kWh file detected - assuming uniform 24-hour usage.";
    public static final String NO_TIME_AXIS_MESSAGE =
        "Unsupported format: no valid time columns or total kWh column found.";

    private static final BigDecimal HOURS_PER_DAY = new BigDecimal("24");
    private static final int POWER_SCALE = 4;

    public NormalizationResult normalize(RawTable source) {
        RawTable table = promoteEmbeddedHeader(source);
        if (table.columnCount() == 0) {
            return NormalizationResult.failure(
                StructuralError.of(StructuralError.Code.NO_TIME_AXIS, NO_TIME_AXIS_MESSAGE));
        }

        List<String> labels = new ArrayList<>(table.getHeader());
        labels.set(0, "date");

        List<Integer> timeColumns = new ArrayList<>();
        int totalColumn = -1;
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            if (label.contains(":")) {
                timeColumns.add(i);
            }
            if (totalColumn < 0 && (containsIgnoreCase(label, "total") || containsIgnoreCase(label, "kwh"))) {
                totalColumn = i;
            }
        }

        if (!timeColumns.isEmpty()) {
            return normalizeIntervals(table, labels, timeColumns);
        }
        if (totalColumn >= 0) {
            return normalizeDailyTotals(table, totalColumn);
        }
        return NormalizationResult.failure(
            StructuralError.of(StructuralError.Code.NO_TIME_AXIS, NO_TIME_AXIS_MESSAGE));
    }

    /** Slot length in hours for a wide table with the given number of intraday columns. */
    public static BigDecimal inferIntervalHours(int timeColumnCount) {
        return timeColumnCount >= QUARTER_HOUR_MIN_COLUMNS ? QUARTER_HOUR : ONE_HOUR;
    }

    private NormalizationResult normalizeIntervals(RawTable table, List<String> labels, List<Integer> timeColumns) {
        BigDecimal intervalHours = inferIntervalHours(timeColumns.size());
        List<Reading> readings = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            String date = table.cell(row, 0);
            for (int col : timeColumns) {
                Optional<LocalDateTime> timestamp = CellParsing.parseTimestamp(date, labels.get(col));
                if (timestamp.isEmpty()) {
                    continue;
                }
                Optional<BigDecimal> energyKwh = CellParsing.parseDecimal(table.cell(row, col));
                energyKwh.ifPresent(kwh -> readings.add(new Reading(timestamp.get(), toPower(kwh, intervalHours))));
            }
        }
        log.debug("Wide table: {} intraday columns, interval {}h, {} readings",
            timeColumns.size(), intervalHours, readings.size());
        return NormalizationResult.success(readings);
    }

    private NormalizationResult normalizeDailyTotals(RawTable table, int totalColumn) {
        List<Reading> readings = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            Optional<LocalDate> date = CellParsing.parseTimestamp(table.cell(row, 0)).map(LocalDateTime::toLocalDate);
            Optional<BigDecimal> totalKwh = CellParsing.parseDecimal(table.cell(row, totalColumn));
            if (date.isEmpty() || totalKwh.isEmpty()) {
                continue;
            }
            BigDecimal averageKw = toPower(totalKwh.get(), HOURS_PER_DAY);
            for (int hour = 0; hour < 24; hour++) {
                readings.add(new Reading(date.get().atTime(hour, 0), averageKw));
            }
        }
        log.warn("Daily total column '{}' used, {} valid days spread uniformly over 24 hours",
            table.getHeader().get(totalColumn), readings.size() / 24);
        return NormalizationResult.success(readings,
            new DataQualityWarning(DataQualityWarning.Code.DAILY_TOTAL_APPROXIMATION, DAILY_TOTAL_WARNING));
    }

    /** Slot energy to power. Whole slots per hour (15 min, 1 h) convert exactly. */
    static BigDecimal toPower(BigDecimal energyKwh, BigDecimal hours) {
        BigDecimal[] slotsPerHour = BigDecimal.ONE.divideAndRemainder(hours);
        if (slotsPerHour[1].signum() == 0) {
            return energyKwh.multiply(slotsPerHour[0]);
        }
        return energyKwh.divide(hours, POWER_SCALE, RoundingMode.HALF_UP);
    }

    /** A header row left in the data (first data row with a "date" cell) is promoted. */
    RawTable promoteEmbeddedHeader(RawTable table) {
        if (table.rowCount() > 0
            && table.getRows().get(0).stream().anyMatch(cell -> containsIgnoreCase(cell, "date"))) {
            return table.promoteRowToHeader(0);
        }
        return table;
    }
}
