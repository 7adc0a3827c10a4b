package com.lynkvertx.evfeas.service;

import com.lynkvertx.evfeas.model.RawTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes uploaded CSV and Excel files into {@link RawTable}s.
 *
 * The first decoded row becomes the header; locating a header embedded further down is left to
 * {@link ShapeClassifier}. Excel date cells are rendered as text the timestamp parser understands.
 */
@Slf4j
@Service
public class TableReaderService {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public RawTable read(String fileName, byte[] content) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        List<List<String>> grid;
        if (name.endsWith(".csv")) {
            grid = readCsv(fileName, content);
        } else if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            grid = readWorkbook(fileName, content);
        } else {
            throw new TableReadException("Unsupported file type: " + fileName + " (expected .csv, .xlsx or .xls)");
        }
        log.debug("Read '{}': {} rows", fileName, grid.size());
        return RawTable.fromGrid(grid);
    }

    List<List<String>> readCsv(String fileName, byte[] content) {
        String text = stripBom(new String(content, StandardCharsets.UTF_8));
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setDelimiter(sniffDelimiter(firstLine(text)))
            .setIgnoreEmptyLines(true)
            .build();

        List<List<String>> grid = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            for (CSVRecord record : parser) {
                List<String> row = new ArrayList<>(record.size());
                record.forEach(row::add);
                grid.add(row);
            }
        } catch (IOException | IllegalStateException | UncheckedIOException e) {
            throw new TableReadException("Failed to read CSV " + fileName + ": " + e.getMessage(), e);
        }
        return grid;
    }

    List<List<String>> readWorkbook(String fileName, byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new TableReadException("Workbook " + fileName + " has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<List<String>> grid = new ArrayList<>();
            for (int rowIdx = sheet.getFirstRowNum(); rowIdx <= sheet.getLastRowNum(); rowIdx++) {
                Row row = sheet.getRow(rowIdx);
                if (row == null || row.getLastCellNum() <= 0) {
                    continue;
                }
                List<String> values = new ArrayList<>(row.getLastCellNum());
                for (int colIdx = 0; colIdx < row.getLastCellNum(); colIdx++) {
                    values.add(cellText(row.getCell(colIdx)));
                }
                grid.add(values);
            }
            return grid;
        } catch (TableReadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new TableReadException("Failed to read workbook " + fileName + ": " + e.getMessage(), e);
        }
    }

    static String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return dateCellText(cell.getNumericCellValue(), cell.getLocalDateTimeCellValue());
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    /**
     * Time-only cells (serial value below one day) become "H:mm", date cells at midnight become
     * a bare date, anything else a full date-time.
     */
    static String dateCellText(double serial, LocalDateTime value) {
        if (serial < 1.0) {
            LocalTime time = value.toLocalTime();
            return time.getSecond() == 0
                ? String.format("%d:%02d", time.getHour(), time.getMinute())
                : String.format("%d:%02d:%02d", time.getHour(), time.getMinute(), time.getSecond());
        }
        if (value.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return value.format(DATE);
        }
        return value.format(DATE_TIME);
    }

    static String stripBom(String value) {
        if (!value.isEmpty() && value.charAt(0) == '\uFEFF') {
            return value.substring(1);
        }
        return value;
    }

    /** Semicolon when the sample holds one, comma otherwise. */
    static char sniffDelimiter(String sample) {
        return sample.indexOf(';') >= 0 ? ';' : ',';
    }

    private static String firstLine(String text) {
        int end = text.indexOf('\n');
        return end < 0 ? text : text.substring(0, end);
    }
}
