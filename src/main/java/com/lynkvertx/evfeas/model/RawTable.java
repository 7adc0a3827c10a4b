package com.lynkvertx.evfeas.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular-ish table as decoded from an upload: one header row plus data rows.
 *
 * Rows are not required to have the same width as the header. Cells are kept as raw strings;
 * a missing or blank cell is returned as an empty string by {@link #cell(int, int)}.
 * Instances are immutable.
 */
@ToString
@EqualsAndHashCode
public final class RawTable {

    private final List<String> header;
    private final List<List<String>> rows;

    public RawTable(List<String> header, List<List<String>> rows) {
        this.header = Collections.unmodifiableList(copyRow(header));
        List<List<String>> copied = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copied.add(Collections.unmodifiableList(copyRow(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    /**
     * Build a table from a raw grid, treating the first grid row as header.
     * An empty grid yields a table with no header and no rows.
     */
    public static RawTable fromGrid(List<List<String>> grid) {
        if (grid.isEmpty()) {
            return new RawTable(Collections.emptyList(), Collections.emptyList());
        }
        return new RawTable(grid.get(0), grid.subList(1, grid.size()));
    }

    public List<String> getHeader() {
        return header;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int columnCount() {
        return header.size();
    }

    public int rowCount() {
        return rows.size();
    }

    /** Header row followed by all data rows. */
    public List<List<String>> asGrid() {
        List<List<String>> grid = new ArrayList<>(rows.size() + 1);
        grid.add(header);
        grid.addAll(rows);
        return grid;
    }

    /** Cell value at (row, column), or "" when the row is shorter than requested. */
    public String cell(int rowIndex, int columnIndex) {
        List<String> row = rows.get(rowIndex);
        if (columnIndex < 0 || columnIndex >= row.size()) {
            return "";
        }
        return row.get(columnIndex);
    }

    /**
     * Re-slice the table so that the data row at {@code rowIndex} becomes the header
     * and only the rows below it remain.
     */
    public RawTable promoteRowToHeader(int rowIndex) {
        return new RawTable(rows.get(rowIndex), rows.subList(rowIndex + 1, rows.size()));
    }

    public RawTable withHeader(List<String> newHeader) {
        return new RawTable(newHeader, rows);
    }

    private static List<String> copyRow(List<String> row) {
        List<String> copy = new ArrayList<>(row.size());
        for (String value : row) {
            copy.add(value == null ? "" : value);
        }
        return copy;
    }
}
