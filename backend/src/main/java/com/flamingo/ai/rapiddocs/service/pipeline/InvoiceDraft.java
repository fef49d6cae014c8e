package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Invoice analysis result with request overrides applied.
 *
 * @param aiTerms ask the text generator for payment terms
 * @param aiNotes ask the text generator for a closing note
 */
public record InvoiceDraft(
    InvoiceExtraction extraction,
    String prompt,
    List<String> colors,
    Path logoPath,
    LocalDate issueDate,
    boolean aiTerms,
    boolean aiNotes,
    String author) {

  public InvoiceDraft {
    colors = List.copyOf(colors);
  }

  public LocalDate dueDate() {
    return issueDate.plusDays(30);
  }
}
