package com.flamingo.ai.rapiddocs.exception;

import java.nio.file.Path;

/** Exception thrown when an import file cannot be read or parsed. */
public class DataImportException extends RuntimeException {

  private final Path file;

  public DataImportException(Path file, String message) {
    super(message);
    this.file = file;
  }

  public DataImportException(Path file, String message, Throwable cause) {
    super(message, cause);
    this.file = file;
  }

  public Path getFile() {
    return file;
  }
}
