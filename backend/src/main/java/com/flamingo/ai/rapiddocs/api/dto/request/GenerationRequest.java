package com.flamingo.ai.rapiddocs.api.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import java.util.List;

/** Fields shared by every document generation request. */
public interface GenerationRequest {

  @JsonIgnore
  DocumentType getDocumentType();

  /** Free-text description of the document to generate. */
  String getPrompt();

  /** Hex colours, may be null or empty for the configured default. */
  List<String> getColorScheme();

  String getLogoPath();

  /** Optional CSV file whose rows are appended to the extracted data. */
  String getImportFilePath();

  String getAuthor();
}
