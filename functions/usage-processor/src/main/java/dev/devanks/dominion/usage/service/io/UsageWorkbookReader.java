package dev.devanks.dominion.usage.service.io;

import dev.devanks.dominion.usage.exception.DataSourceException;
import dev.devanks.dominion.usage.exception.TransformException;
import dev.devanks.dominion.usage.exception.UsageProcessingException;
import dev.devanks.dominion.usage.model.RawWideTable;
import dev.devanks.dominion.usage.model.WideTableRow;
import dev.devanks.dominion.usage.transform.TimeOfDayLabels;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the utility's usage export workbook into one wide table per sheet, keyed by sheet name in
 * workbook order.
 */
@Component
@Slf4j
public class UsageWorkbookReader {

    public static final String DATE_COLUMN = "Date";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("M/d/yyyy");

    private final DataFormatter dataFormatter = new DataFormatter();

    public Map<String, RawWideTable> read(Resource resource) {
        log.info("Reading usage export {}", resource.getDescription());
        try (InputStream inputStream = resource.getInputStream()) {
            return read(inputStream);
        } catch (IOException e) {
            throw new DataSourceException("Failed to read usage export " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    public Map<String, RawWideTable> read(InputStream inputStream) {
        try (Workbook workbook = WorkbookFactory.create(inputStream)) {
            Map<String, RawWideTable> sheets = new LinkedHashMap<>();
            for (Sheet sheet : workbook) {
                sheets.put(sheet.getSheetName(), readSheet(sheet));
            }
            log.info("Read {} sheets from usage export: {}", sheets.size(), sheets.keySet());
            return sheets;
        } catch (UsageProcessingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DataSourceException("Failed to read usage export workbook: " + e.getMessage(), e);
        }
    }

    private RawWideTable readSheet(Sheet sheet) {
        Row header = sheet.getRow(sheet.getFirstRowNum());
        if (header == null) {
            log.debug("Sheet '{}' is empty.", sheet.getSheetName());
            return new RawWideTable(sheet.getSheetName(), List.of(), List.of());
        }

        int dateIndex = -1;
        Map<Integer, String> timeColumns = new LinkedHashMap<>();
        for (Cell cell : header) {
            String name = dataFormatter.formatCellValue(cell).trim();
            if (DATE_COLUMN.equalsIgnoreCase(name)) {
                dateIndex = cell.getColumnIndex();
            } else if (TimeOfDayLabels.isTimeColumn(name)) {
                timeColumns.put(cell.getColumnIndex(), name);
            }
        }

        if (timeColumns.isEmpty()) {
            log.debug("Sheet '{}' has no time-of-day columns, keeping it without rows.", sheet.getSheetName());
            return new RawWideTable(sheet.getSheetName(), List.of(), List.of());
        }
        if (dateIndex < 0) {
            throw new DataSourceException(String.format("Sheet '%s' has time-of-day columns but no '%s' column.",
                    sheet.getSheetName(), DATE_COLUMN));
        }

        List<WideTableRow> rows = new ArrayList<>();
        for (int rowIndex = header.getRowNum() + 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            LocalDate date = row == null ? null : readDate(sheet, row.getCell(dateIndex));
            if (date == null) {
                continue;
            }
            Map<String, Double> values = new LinkedHashMap<>();
            timeColumns.forEach((index, name) -> values.put(name, readValue(row.getCell(index))));
            rows.add(new WideTableRow(date, values));
        }

        log.debug("Sheet '{}': {} days, {} time-of-day columns.", sheet.getSheetName(), rows.size(), timeColumns.size());
        return new RawWideTable(sheet.getSheetName(), List.copyOf(timeColumns.values()), rows);
    }

    private LocalDate readDate(Sheet sheet, Cell cell) {
        if (cell == null) {
            return null;
        }
        if (cellType(cell) == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate();
        }
        String text = dataFormatter.formatCellValue(cell).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text, DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new TransformException(String.format("Cannot parse date '%s' in sheet '%s' row %d.",
                    text, sheet.getSheetName(), cell.getRowIndex() + 1), e);
        }
    }

    private double readValue(Cell cell) {
        if (cell == null) {
            return 0.0;
        }
        return switch (cellType(cell)) {
            case NUMERIC -> cell.getNumericCellValue();
            case STRING -> parseNumber(cell.getStringCellValue());
            default -> 0.0;
        };
    }

    private double parseNumber(String text) {
        String trimmed = text.trim().replace(",", "");
        if (trimmed.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new TransformException("Cannot parse usage value '" + text + "'.", e);
        }
    }

    private CellType cellType(Cell cell) {
        return cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
    }
}
