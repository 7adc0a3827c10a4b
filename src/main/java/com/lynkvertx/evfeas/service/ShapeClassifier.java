package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.ClassifiedTable;
import com.lynkvertx.evfeas.model.RawTable;
import com.lynkvertx.evfeas.model.TableShape;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalInt;

import static com.lynkvertx.evfeas.util.CellParsing.containsIgnoreCase;

/**
 * Decides whether an uploaded table is in tall or wide layout.
 *
 * Rules, first match wins:
 * 1. Scan the first rows (header included) for a row holding both a "date" cell and a cell
 *    with ":"; when found below the current header, that row becomes the header.
 * 2. A table with a "date" column and at least {@value #WIDE_MIN_TIME_COLUMNS} time-of-day
 *    columns is WIDE.
 * 3. Anything else is TALL. Partial wide tables are not repaired; the tall normalizer reports them.
 */
@Slf4j
@Service
public class ShapeClassifier {

    /** Number of leading rows examined when looking for an embedded header */
    public static final int HEADER_SCAN_ROWS = 5;

    public static final int WIDE_MIN_TIME_COLUMNS = 20;

    /**
     * Locate the semantic header among the first {@code maxRows} rows.
     *
     * @return index of the first row containing both a "date" cell and a ":" cell, or empty
     */
    public OptionalInt locateHeaderRow(List<List<String>> rows, int maxRows) {
        int limit = Math.min(maxRows, rows.size());
        for (int i = 0; i < limit; i++) {
            List<String> row = rows.get(i);
            boolean hasDate = row.stream().anyMatch(cell -> containsIgnoreCase(cell, "date"));
            boolean hasTime = row.stream().anyMatch(cell -> cell != null && cell.contains(":"));
            if (hasDate && hasTime) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Classify the table. Never throws; an unusable table is simply routed to TALL.
     */
    public ClassifiedTable classify(RawTable table) {
        RawTable effective = table;
        int promoted = -1;

        OptionalInt headerIndex = locateHeaderRow(table.asGrid(), HEADER_SCAN_ROWS);
        if (headerIndex.isPresent() && headerIndex.getAsInt() > 0) {
            // grid index 0 is the current header, so data row = grid index - 1
            promoted = headerIndex.getAsInt() - 1;
            effective = table.promoteRowToHeader(promoted);
            log.debug("Promoted data row {} to header", promoted);
        }

        List<String> labels = effective.getHeader();
        int timeColumns = countTimeOfDayColumns(labels);
        boolean hasDate = labels.stream().anyMatch(label -> containsIgnoreCase(label, "date"));

        TableShape shape = hasDate && timeColumns >= WIDE_MIN_TIME_COLUMNS ? TableShape.WIDE : TableShape.TALL;
        return new ClassifiedTable(shape, effective, promoted, timeColumns);
    }

    static int countTimeOfDayColumns(List<String> labels) {
        int count = 0;
        for (String label : labels) {
            if (label != null && label.contains(":")) {
                count++;
            }
        }
        return count;
    }
}
