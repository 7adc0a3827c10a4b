package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.RawTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Builders for synthetic upload tables. */
final class TestTables {

    private TestTables() {
    }

    static RawTable table(List<String> header, List<List<String>> rows) {
        return new RawTable(header, rows);
    }

    static List<String> row(String... cells) {
        return Arrays.asList(cells);
    }

    /** "0:00", "0:15", ... for 96 slots or "0:00", "1:00", ... for 24 slots. */
    static List<String> timeLabels(int slots) {
        int stepMinutes = 24 * 60 / slots;
        List<String> labels = new ArrayList<>(slots);
        for (int i = 0; i < slots; i++) {
            int minutes = i * stepMinutes;
            labels.add(String.format("%d:%02d", minutes / 60, minutes % 60));
        }
        return labels;
    }

    static List<String> wideHeader(int slots) {
        List<String> header = new ArrayList<>();
        header.add("Date");
        header.addAll(timeLabels(slots));
        return header;
    }

    static List<String> wideRow(String date, int slots, String value) {
        List<String> row = new ArrayList<>();
        row.add(date);
        row.addAll(Collections.nCopies(slots, value));
        return row;
    }
}
