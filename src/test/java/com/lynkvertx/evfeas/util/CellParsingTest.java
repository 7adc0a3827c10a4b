package com.lynkvertx.evfeas.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CellParsingTest {

    @Test
    void parsesCommonTimestampLayouts() {
        LocalDateTime expected = LocalDateTime.of(2024, 3, 7, 14, 30);
        assertThat(CellParsing.parseTimestamp("2024-03-07 14:30")).contains(expected);
        assertThat(CellParsing.parseTimestamp("2024-03-07T14:30:00")).contains(expected);
        assertThat(CellParsing.parseTimestamp("3/7/2024 14:30")).contains(expected);
        assertThat(CellParsing.parseTimestamp("3/7/2024 2:30 PM")).contains(expected);
        assertThat(CellParsing.parseTimestamp("07.03.2024 14:30")).contains(expected);
    }

    @Test
    void bareDateIsMidnight() {
        assertThat(CellParsing.parseTimestamp("2024-03-07")).contains(LocalDateTime.of(2024, 3, 7, 0, 0));
    }

    @Test
    void combinesDateAndTimeCells() {
        assertThat(CellParsing.parseTimestamp(" 2024-03-07", "0:15 ")).contains(LocalDateTime.of(2024, 3, 7, 0, 15));
    }

    @Test
    void parsesMonthNameDates() {
        assertThat(CellParsing.parseTimestamp("01-Jan-2024", "0:15")).contains(LocalDateTime.of(2024, 1, 1, 0, 15));
        assertThat(CellParsing.parseTimestamp("5 MAR 2024 13:00")).contains(LocalDateTime.of(2024, 3, 5, 13, 0));
        assertThat(CellParsing.parseTimestamp("Mar 5, 2024")).contains(LocalDateTime.of(2024, 3, 5, 0, 0));
        assertThat(CellParsing.parseDate("01-Jan-2024")).contains(LocalDate.of(2024, 1, 1));
    }

    @Test
    void isoOffsetIsDroppedAndWallClockKept() {
        LocalDateTime expected = LocalDateTime.of(2024, 3, 7, 14, 30);
        assertThat(CellParsing.parseTimestamp("2024-03-07T14:30:00Z")).contains(expected);
        assertThat(CellParsing.parseTimestamp("2024-03-07T14:30:00+01:00")).contains(expected);
        assertThat(CellParsing.parseTimestamp("2024-03-07 14:30:00-0500")).contains(expected);
    }

    @Test
    void fractionalSecondsOfAnyWidth() {
        assertThat(CellParsing.parseTimestamp("2024-03-07 14:30:00.5"))
            .contains(LocalDateTime.of(2024, 3, 7, 14, 30, 0, 500_000_000));
        assertThat(CellParsing.parseTimestamp("2024-03-07T14:30:00.123456789Z"))
            .contains(LocalDateTime.of(2024, 3, 7, 14, 30, 0, 123_456_789));
    }

    @Test
    void rejectsInvalidTimestamps() {
        assertThat(CellParsing.parseTimestamp("2024-03-07 24:00")).isEmpty();
        assertThat(CellParsing.parseTimestamp("2024-02-30 10:00")).isEmpty();
        assertThat(CellParsing.parseTimestamp("")).isEmpty();
        assertThat(CellParsing.parseTimestamp(null)).isEmpty();
        assertThat(CellParsing.parseTimestamp("yesterday")).isEmpty();
    }

    @Test
    void decimalCoercionIsStrict() {
        assertThat(CellParsing.parseDecimal(" 12.50 ")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("12.5"));
        assertThat(CellParsing.parseDecimal("-3")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("-3"));
        assertThat(CellParsing.parseDecimal("1,234")).isEmpty();
        assertThat(CellParsing.parseDecimal("NaN")).isEmpty();
        assertThat(CellParsing.parseDecimal("")).isEmpty();
        assertThat(CellParsing.parseDecimal(null)).isEmpty();
    }
}
