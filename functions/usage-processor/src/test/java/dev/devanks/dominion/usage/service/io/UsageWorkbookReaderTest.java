package dev.devanks.dominion.usage.service.io;

import dev.devanks.dominion.usage.exception.DataSourceException;
import dev.devanks.dominion.usage.exception.TransformException;
import dev.devanks.dominion.usage.model.Metric;
import dev.devanks.dominion.usage.model.RawWideTable;
import dev.devanks.dominion.usage.model.WideTableRow;
import dev.devanks.dominion.usage.transform.LongFormatReshaper;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UsageWorkbookReader Unit Tests")
class UsageWorkbookReaderTest {

    private final UsageWorkbookReader reader = new UsageWorkbookReader();

    @Test
    @DisplayName("read: every sheet becomes a wide table keyed by name, in workbook order")
    void read_twoSheets_returnsTablesInOrder() throws IOException {
        byte[] bytes = workbook(workbook -> {
            Sheet power = workbook.createSheet("kW Usage Data");
            header(power, "Account", "Date", "12:00 AM kW", "12:30 AM kW", "Total");
            Row day1 = power.createRow(1);
            day1.createCell(0).setCellValue("123");
            day1.createCell(1).setCellValue("1/15/2024");
            day1.createCell(2).setCellValue(1.25);
            day1.createCell(3).setCellValue(2.5);
            day1.createCell(4).setCellValue(3.75);

            Sheet energy = workbook.createSheet("kWH Usage Data");
            header(energy, "Date", "12:00 AM kWH", "12:30 AM kWH");
            Row row = energy.createRow(1);
            row.createCell(0).setCellValue("1/15/2024");
            row.createCell(1).setCellValue(0.5);
            row.createCell(2).setCellValue(" 1,000.5 ");
        });

        Map<String, RawWideTable> sheets = reader.read(new ByteArrayInputStream(bytes));

        assertThat(sheets).containsOnlyKeys("kW Usage Data", "kWH Usage Data");
        assertThat(sheets.keySet()).containsExactly("kW Usage Data", "kWH Usage Data");

        RawWideTable power = sheets.get("kW Usage Data");
        assertThat(power.getTimeColumns()).containsExactly("12:00 AM kW", "12:30 AM kW");
        assertThat(power.getRows()).singleElement()
                .satisfies(day -> {
                    assertThat(day.getDate()).isEqualTo(LocalDate.of(2024, 1, 15));
                    assertThat(day.value("12:00 AM kW")).isEqualTo(1.25);
                    assertThat(day.value("12:30 AM kW")).isEqualTo(2.5);
                    assertThat(day.getTotal()).isEqualTo(3.75);
                });

        assertThat(sheets.get("kWH Usage Data").getRows().get(0).value("12:30 AM kWH")).isEqualTo(1000.5);
    }

    @Test
    @DisplayName("read: date-formatted numeric cells are read as dates, blank values as zero")
    void read_numericDateAndBlankValue() throws IOException {
        byte[] bytes = workbook(workbook -> {
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("m/d/yyyy"));

            Sheet sheet = workbook.createSheet("kW Usage Data");
            header(sheet, "Date", "12:00 AM", "12:30 AM");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue(LocalDate.of(2024, 3, 10));
            row.getCell(0).setCellStyle(dateStyle);
            row.createCell(1).setCellValue(0.75);
            row.createCell(2).setBlank();
        });

        RawWideTable table = reader.read(new ByteArrayInputStream(bytes)).get("kW Usage Data");

        WideTableRow day = table.getRows().get(0);
        assertThat(day.getDate()).isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(day.value("12:00 AM")).isEqualTo(0.75);
        assertThat(day.value("12:30 AM")).isZero();
    }

    @Test
    @DisplayName("read: rows without a date are skipped")
    void read_rowWithoutDate_skipped() throws IOException {
        byte[] bytes = workbook(workbook -> {
            Sheet sheet = workbook.createSheet("kW Usage Data");
            header(sheet, "Date", "12:00 AM");
            sheet.createRow(1).createCell(1).setCellValue(9.0);
            Row row = sheet.createRow(2);
            row.createCell(0).setCellValue("1/16/2024");
            row.createCell(1).setCellValue(1.0);
        });

        RawWideTable table = reader.read(new ByteArrayInputStream(bytes)).get("kW Usage Data");

        assertThat(table.getRows()).extracting(WideTableRow::getDate).containsExactly(LocalDate.of(2024, 1, 16));
    }

    @Test
    @DisplayName("read: malformed time-of-day headers are kept and fail when the sheet is reshaped")
    void read_malformedTimeHeaders_keptAndRejectedByReshape() throws IOException {
        byte[] bytes = workbook(workbook -> {
            Sheet sheet = workbook.createSheet("kW Usage Data");
            header(sheet, "Date", "12:00 AM", "12:30AM", "1.00 AM");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("1/16/2024");
            row.createCell(1).setCellValue(1.0);
            row.createCell(2).setCellValue(2.0);
            row.createCell(3).setCellValue(3.0);
        });

        RawWideTable table = reader.read(new ByteArrayInputStream(bytes)).get("kW Usage Data");

        assertThat(table.getTimeColumns()).containsExactly("12:00 AM", "12:30AM", "1.00 AM");
        assertThatThrownBy(() -> new LongFormatReshaper().reshape(table, Metric.POWER))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("12:30AM");
    }

    @Test
    @DisplayName("read: a sheet without time columns is kept as an empty table")
    void read_sheetWithoutTimeColumns_empty() throws IOException {
        byte[] bytes = workbook(workbook -> header(workbook.createSheet("Notes"), "Account", "Comment"));

        RawWideTable notes = reader.read(new ByteArrayInputStream(bytes)).get("Notes");

        assertThat(notes.isEmpty()).isTrue();
        assertThat(notes.getTimeColumns()).isEmpty();
    }

    @Test
    @DisplayName("read: time columns without a Date column are a data source error")
    void read_missingDateColumn_throws() throws IOException {
        byte[] bytes = workbook(workbook -> header(workbook.createSheet("kW Usage Data"), "Day", "12:00 AM"));

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(bytes)))
                .isInstanceOf(DataSourceException.class)
                .hasMessageContaining("'Date'");
    }

    @Test
    @DisplayName("read: an unparseable date is a transform error")
    void read_badDate_throws() throws IOException {
        byte[] bytes = workbook(workbook -> {
            Sheet sheet = workbook.createSheet("kW Usage Data");
            header(sheet, "Date", "12:00 AM");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("2024-01-15");
            row.createCell(1).setCellValue(1.0);
        });

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(bytes)))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("2024-01-15");
    }

    @Test
    @DisplayName("read: bytes that are not a workbook are a data source error")
    void read_notAWorkbook_throws() {
        InputStream garbage = new ByteArrayInputStream("not a spreadsheet".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> reader.read(garbage))
                .isInstanceOf(DataSourceException.class)
                .hasMessageStartingWith("Failed to read usage export workbook");
    }

    @Test
    @DisplayName("read(Resource): reads the workbook behind a resource")
    void read_resource() throws IOException {
        byte[] bytes = workbook(workbook -> {
            Sheet sheet = workbook.createSheet("kW Usage Data");
            header(sheet, "Date", "12:00 AM");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("1/15/2024");
            row.createCell(1).setCellValue(1.0);
        });

        Map<String, RawWideTable> sheets = reader.read(new ByteArrayResource(bytes));

        assertThat(sheets).containsKey("kW Usage Data");
    }

    private interface WorkbookContent {
        void fill(Workbook workbook);
    }

    private static byte[] workbook(WorkbookContent content) throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            content.fill(workbook);
            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static void header(Sheet sheet, String... names) {
        Row header = sheet.createRow(0);
        for (int i = 0; i < names.length; i++) {
            header.createCell(i).setCellValue(names[i]);
        }
    }
}
