package com.flamingo.ai.rapiddocs.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.rapiddocs.exception.DataImportException;
import com.flamingo.ai.rapiddocs.service.importer.CsvDataImporter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImportedDataLoaderTest {

  private final ImportedDataLoader loader =
      new ImportedDataLoader(List.of(new CsvDataImporter()));

  @TempDir Path dir;

  @Test
  void shouldAcceptBlankPath() {
    assertThat(loader.check(null)).isEmpty();
    assertThat(loader.check("  ")).isEmpty();
    assertThat(loader.load(null)).isEmpty();
  }

  @Test
  void shouldReportInvalidPath_insteadOfThrowing() {
    assertThat(loader.check("data\u0000.csv")).contains("importFilePath: invalid path");
  }

  @Test
  void shouldReportMissingFile() {
    assertThat(loader.check(dir.resolve("none.csv").toString()))
        .hasValueSatisfying(
            error -> assertThat(error).startsWith("importFilePath: file not found"));
  }

  @Test
  void shouldReportUnsupportedFormat() throws IOException {
    Path file = Files.writeString(dir.resolve("data.json"), "{}");

    assertThat(loader.check(file.toString()))
        .contains("importFilePath: unsupported file format: data.json");
    assertThatThrownBy(() -> loader.load(file.toString()))
        .isInstanceOf(DataImportException.class);
  }

  @Test
  void shouldLoadSupportedFile() throws IOException {
    Path file = Files.writeString(dir.resolve("stats.csv"), "name,value\nUsers,10\n");

    assertThat(loader.check(file.toString())).isEmpty();
    assertThat(loader.load(file.toString())).hasSize(1);
  }
}
