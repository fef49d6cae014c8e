package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.exception.DataImportException;
import com.flamingo.ai.rapiddocs.service.importer.DataImporter;
import com.flamingo.ai.rapiddocs.service.importer.ImportedRecord;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Resolves a request's import file to the importer that can read it. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportedDataLoader {

  private final List<DataImporter> importers;

  /** Returns an error message when the file cannot be imported, empty when it can. */
  public Optional<String> check(String importFilePath) {
    if (isBlank(importFilePath)) {
      return Optional.empty();
    }
    Path file;
    try {
      file = Path.of(importFilePath.strip());
    } catch (InvalidPathException e) {
      return Optional.of("importFilePath: invalid path");
    }
    if (!Files.isRegularFile(file)) {
      return Optional.of("importFilePath: file not found: " + importFilePath);
    }
    if (findImporter(file).isEmpty()) {
      return Optional.of("importFilePath: unsupported file format: " + file.getFileName());
    }
    return Optional.empty();
  }

  /** Reads the import file, or returns an empty list when the request names none. */
  public List<ImportedRecord> load(String importFilePath) {
    if (isBlank(importFilePath)) {
      return List.of();
    }
    Path file = Path.of(importFilePath.strip());
    DataImporter importer =
        findImporter(file)
            .orElseThrow(
                () -> new DataImportException(file, "Unsupported import file type: " + file));
    List<ImportedRecord> records = importer.importFile(file);
    log.info("Imported {} records from {}", records.size(), file.getFileName());
    return records;
  }

  private Optional<DataImporter> findImporter(Path file) {
    return importers.stream().filter(importer -> importer.supports(file)).findFirst();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
