package com.flamingo.ai.rapiddocs.service.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import com.flamingo.ai.rapiddocs.exception.DataImportException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XlsxDataImporterTest {

  private final XlsxDataImporter importer = new XlsxDataImporter();

  @TempDir Path dir;

  @Test
  void shouldSupportExcelExtensionsOnly() {
    assertThat(importer.supports(Path.of("stats.xlsx"))).isTrue();
    assertThat(importer.supports(Path.of("LEGACY.XLS"))).isTrue();
    assertThat(importer.supports(Path.of("stats.csv"))).isFalse();
    assertThat(importer.supports(null)).isFalse();
  }

  @Test
  void shouldImportStatisticsFromFirstSheet() throws IOException {
    // Given
    Path file = dir.resolve("stats.xlsx");
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      Sheet sheet = workbook.createSheet("Stats");
      header(sheet.createRow(0), "Label", "Amount", "Unit", "Chart_Type");
      Row approval = sheet.createRow(1);
      approval.createCell(0).setCellValue("Approval Rate");
      approval.createCell(1).setCellValue(72);
      approval.createCell(2).setCellValue("%");
      approval.createCell(3).setCellValue("gauge");
      Row revenue = sheet.createRow(3);
      revenue.createCell(0).setCellValue("Revenue");
      revenue.createCell(1).setCellFormula("1000+500");
      revenue.createCell(2).setCellValue("USD");
      workbook.createSheet("Ignored").createRow(0).createCell(0).setCellValue("name");
      try (OutputStream out = Files.newOutputStream(file)) {
        workbook.write(out);
      }
    }

    // When
    List<ImportedRecord> records = importer.importFile(file);

    // Then
    assertThat(records).extracting(ImportedRecord::rowNumber).containsExactly(2, 4);
    assertThat(records.stream().map(ImportedRecord::toStatistic).toList())
        .containsExactly(
            new StatisticEntry("Approval Rate", 72, "%", VisualizationType.GAUGE),
            new StatisticEntry("Revenue", 1500, "USD", VisualizationType.BAR));
  }

  @Test
  void shouldRejectWorkbookWithoutHeaderRow() throws IOException {
    // Given
    Path file = dir.resolve("empty.xlsx");
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      workbook.createSheet("Empty");
      try (OutputStream out = Files.newOutputStream(file)) {
        workbook.write(out);
      }
    }

    // When / Then
    assertThatThrownBy(() -> importer.importFile(file))
        .isInstanceOf(DataImportException.class)
        .hasMessage("Import file has no header row");
  }

  @Test
  void shouldWrapUnreadableWorkbook() throws IOException {
    // Given
    Path file = Files.writeString(dir.resolve("broken.xlsx"), "not a workbook");

    // When / Then
    assertThatThrownBy(() -> importer.importFile(file)).isInstanceOf(DataImportException.class);
  }

  private static void header(Row row, String... names) {
    for (int c = 0; c < names.length; c++) {
      row.createCell(c).setCellValue(names[c]);
    }
  }
}
