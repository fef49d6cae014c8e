package com.flamingo.ai.rapiddocs.exception;

/** Exception thrown when a requested generated document does not exist. */
public class GeneratedFileNotFoundException extends RuntimeException {

  private final String fileName;

  public GeneratedFileNotFoundException(String fileName) {
    super("Generated file not found: " + fileName);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
