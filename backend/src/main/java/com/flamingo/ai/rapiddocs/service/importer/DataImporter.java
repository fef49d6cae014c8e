package com.flamingo.ai.rapiddocs.service.importer;

import java.nio.file.Path;
import java.util.List;

/** Reads tabular data (statistics or invoice line items) from a file. */
public interface DataImporter {

  /**
   * Reads every data row of {@code file}.
   *
   * @return rows in file order; blank rows are skipped
   * @throws com.flamingo.ai.rapiddocs.exception.DataImportException if the file is missing, has
   *     an unsupported format or cannot be parsed
   */
  List<ImportedRecord> importFile(Path file);

  /** Whether this importer understands the file's extension. */
  boolean supports(Path file);
}
