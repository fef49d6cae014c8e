package com.flamingo.ai.rapiddocs.service.importer;

import com.flamingo.ai.rapiddocs.exception.DataImportException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Imports comma-separated files with a header row. Quoted fields may contain commas, doubled
 * quotes and line breaks.
 */
@Component
@Slf4j
public class CsvDataImporter implements DataImporter {

  private static final char DELIMITER = ',';
  private static final char QUOTE = '"';

  @Override
  public boolean supports(Path file) {
    return file != null
        && file.getFileName() != null
        && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
  }

  @Override
  public List<ImportedRecord> importFile(Path file) {
    if (!supports(file)) {
      throw new DataImportException(file, "Unsupported import file type: " + file);
    }
    if (!Files.isRegularFile(file)) {
      throw new DataImportException(file, "Import file not found: " + file);
    }
    log.info("Importing CSV file: {}", file.getFileName());

    List<List<String>> rows;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      rows = parse(reader);
    } catch (IOException e) {
      throw new DataImportException(file, "Failed to read import file: " + e.getMessage(), e);
    }
    if (rows.isEmpty()) {
      throw new DataImportException(file, "Import file has no header row");
    }

    List<String> headers = rows.get(0);
    if (!headers.isEmpty()) {
      headers.set(0, stripByteOrderMark(headers.get(0)));
    }
    List<ImportedRecord> records = new ArrayList<>();
    for (int r = 1; r < rows.size(); r++) {
      List<String> row = rows.get(r);
      if (row.stream().allMatch(String::isBlank)) {
        continue;
      }
      Map<String, String> values = new LinkedHashMap<>();
      for (int c = 0; c < headers.size(); c++) {
        values.put(headers.get(c), c < row.size() ? row.get(c) : "");
      }
      records.add(new ImportedRecord(r + 1, values));
    }
    log.info("Imported {} records from {}", records.size(), file.getFileName());
    return records;
  }

  /** RFC 4180 style parsing; rows are returned with their fields unquoted. */
  static List<List<String>> parse(BufferedReader reader) throws IOException {
    List<List<String>> rows = new ArrayList<>();
    List<String> row = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    boolean pending = false;

    int next;
    while ((next = reader.read()) != -1) {
      char ch = (char) next;
      pending = true;
      if (quoted) {
        if (ch == QUOTE) {
          reader.mark(1);
          int peek = reader.read();
          if (peek == QUOTE) {
            field.append(QUOTE);
          } else {
            quoted = false;
            if (peek != -1) {
              reader.reset();
            }
          }
        } else {
          field.append(ch);
        }
      } else if (ch == QUOTE) {
        quoted = true;
      } else if (ch == DELIMITER) {
        row.add(field.toString().strip());
        field.setLength(0);
      } else if (ch == '\n' || ch == '\r') {
        if (ch == '\r') {
          reader.mark(1);
          if (reader.read() != '\n') {
            reader.reset();
          }
        }
        row.add(field.toString().strip());
        field.setLength(0);
        rows.add(row);
        row = new ArrayList<>();
        pending = false;
      } else {
        field.append(ch);
      }
    }
    if (pending) {
      row.add(field.toString().strip());
      rows.add(row);
    }
    return rows;
  }

  private static String stripByteOrderMark(String header) {
    return header.startsWith("\uFEFF") ? header.substring(1) : header;
  }
}
