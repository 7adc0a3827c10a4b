package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.ClassifiedTable;
import com.lynkvertx.evfeas.model.RawTable;
import com.lynkvertx.evfeas.model.TableShape;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import static com.lynkvertx.evfeas.service.TestTables.row;
import static com.lynkvertx.evfeas.service.TestTables.table;
import static com.lynkvertx.evfeas.service.TestTables.timeLabels;
import static com.lynkvertx.evfeas.service.TestTables.wideHeader;
import static com.lynkvertx.evfeas.service.TestTables.wideRow;
import static org.assertj.core.api.Assertions.assertThat;

class ShapeClassifierTest {

    private final ShapeClassifier classifier = new ShapeClassifier();

    @Test
    void locateHeaderRowFindsFirstRowWithDateAndTimeCells() {
        List<List<String>> rows = List.of(
            row("Utility export", ""),
            row("Account 42", "12:30"),
            row("DATE", "0:15", "0:30"),
            row("Date", "1:00"));

        assertThat(classifier.locateHeaderRow(rows, 5)).isEqualTo(OptionalInt.of(2));
    }

    @Test
    void locateHeaderRowIsBoundedToScanWindow() {
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rows.add(row("filler", "x"));
        }
        rows.add(row("Date", "0:15"));

        assertThat(classifier.locateHeaderRow(rows, 5)).isEmpty();
        assertThat(classifier.locateHeaderRow(rows, 6)).isEqualTo(OptionalInt.of(5));
    }

    @Test
    void wideTableWithDateAndTwentyFourSlotsIsWide() {
        RawTable raw = table(wideHeader(24), List.of(wideRow("2024-01-01", 24, "1.0")));

        ClassifiedTable classified = classifier.classify(raw);

        assertThat(classified.getShape()).isEqualTo(TableShape.WIDE);
        assertThat(classified.getTimeOfDayColumnCount()).isEqualTo(24);
        assertThat(classified.getPromotedHeaderRow()).isEqualTo(-1);
    }

    @Test
    void partialWideTableIsRoutedToTall() {
        List<String> header = new ArrayList<>();
        header.add("Date");
        header.addAll(timeLabels(96).subList(0, 19));
        RawTable raw = table(header, List.of(wideRow("2024-01-01", 19, "1.0")));

        assertThat(classifier.classify(raw).getShape()).isEqualTo(TableShape.TALL);
    }

    @Test
    void manyTimeColumnsWithoutDateLabelIsTall() {
        List<String> header = new ArrayList<>();
        header.add("Day");
        header.addAll(timeLabels(24));
        RawTable raw = table(header, List.of(wideRow("2024-01-01", 24, "1.0")));

        assertThat(classifier.classify(raw).getShape()).isEqualTo(TableShape.TALL);
    }

    @Test
    void embeddedHeaderIsPromotedBeforeClassification() {
        List<String> title = new ArrayList<>(Collections.nCopies(25, ""));
        title.set(0, "Interval usage report");
        RawTable raw = table(title, List.of(
            row("Meter 123"),
            wideHeader(24),
            wideRow("2024-01-01", 24, "2.0")));

        ClassifiedTable classified = classifier.classify(raw);

        assertThat(classified.getShape()).isEqualTo(TableShape.WIDE);
        assertThat(classified.getPromotedHeaderRow()).isEqualTo(1);
        assertThat(classified.getTable().getHeader().get(0)).isEqualTo("Date");
        assertThat(classified.getTable().rowCount()).isEqualTo(1);
    }

    @Test
    void tallTableIsTall() {
        RawTable raw = table(row("timestamp", "kW"), List.of(row("2024-01-01 00:15", "3.2")));

        ClassifiedTable classified = classifier.classify(raw);

        assertThat(classified.getShape()).isEqualTo(TableShape.TALL);
        assertThat(classified.getTable()).isEqualTo(raw);
    }

    @Test
    void emptyTableDoesNotThrow() {
        ClassifiedTable classified = classifier.classify(RawTable.fromGrid(Collections.emptyList()));

        assertThat(classified.getShape()).isEqualTo(TableShape.TALL);
    }
}
