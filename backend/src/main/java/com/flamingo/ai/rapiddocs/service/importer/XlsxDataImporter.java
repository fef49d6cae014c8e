package com.flamingo.ai.rapiddocs.service.importer;

import com.flamingo.ai.rapiddocs.exception.DataImportException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

/**
 * Imports the first sheet of an Excel workbook. The first non-empty row is the header row; cells
 * are read as displayed, with formulas evaluated.
 */
@Component
@Slf4j
public class XlsxDataImporter implements DataImporter {

  private static final List<String> EXTENSIONS = List.of(".xlsx", ".xls");

  @Override
  public boolean supports(Path file) {
    if (file == null || file.getFileName() == null) {
      return false;
    }
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    return EXTENSIONS.stream().anyMatch(name::endsWith);
  }

  @Override
  public List<ImportedRecord> importFile(Path file) {
    if (!supports(file)) {
      throw new DataImportException(file, "Unsupported import file type: " + file);
    }
    if (!Files.isRegularFile(file)) {
      throw new DataImportException(file, "Import file not found: " + file);
    }
    log.info("Importing Excel file: {}", file.getFileName());

    try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new DataImportException(file, "Import file has no header row");
      }
      List<ImportedRecord> records = readSheet(file, workbook);
      log.info("Imported {} records from {}", records.size(), file.getFileName());
      return records;
    } catch (IOException | EncryptedDocumentException e) {
      throw new DataImportException(file, "Failed to read import file: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      if (e instanceof DataImportException) {
        throw e;
      }
      throw new DataImportException(file, "Unreadable workbook: " + e.getMessage(), e);
    }
  }

  private static List<ImportedRecord> readSheet(Path file, Workbook workbook) {
    Sheet sheet = workbook.getSheetAt(0);
    DataFormatter formatter = new DataFormatter(Locale.ROOT);
    FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

    List<String> headers = null;
    List<ImportedRecord> records = new ArrayList<>();
    for (Row row : sheet) {
      List<String> cells = cells(row, formatter, evaluator);
      if (cells.stream().allMatch(String::isBlank)) {
        continue;
      }
      if (headers == null) {
        headers = cells;
        continue;
      }
      Map<String, String> values = new LinkedHashMap<>();
      for (int c = 0; c < headers.size(); c++) {
        if (!headers.get(c).isBlank()) {
          values.put(headers.get(c), c < cells.size() ? cells.get(c) : "");
        }
      }
      records.add(new ImportedRecord(row.getRowNum() + 1, values));
    }
    if (headers == null) {
      throw new DataImportException(file, "Import file has no header row");
    }
    return records;
  }

  private static List<String> cells(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
    List<String> cells = new ArrayList<>();
    short last = row.getLastCellNum();
    for (int c = 0; c < last; c++) {
      Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
      cells.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator).strip());
    }
    return cells;
  }
}
