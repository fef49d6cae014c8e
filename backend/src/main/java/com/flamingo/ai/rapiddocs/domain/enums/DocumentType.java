package com.flamingo.ai.rapiddocs.domain.enums;

/** Kinds of document the generation pipeline can produce. */
public enum DocumentType {
  INVOICE("invoice"),
  REPORT("infographic");

  private final String filePrefix;

  DocumentType(String filePrefix) {
    this.filePrefix = filePrefix;
  }

  public String getFilePrefix() {
    return filePrefix;
  }
}
