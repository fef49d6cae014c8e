package com.flamingo.ai.rapiddocs.service.extraction;

import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;

/**
 * Turns a free-text prompt into a complete extraction by running the regex and AI extractors and
 * merging their results.
 */
public interface PromptAnalysisService {

  /**
   * Analyzes an invoice prompt.
   *
   * @param prompt the user prompt
   * @return an extraction with every scalar filled and at least one line item
   */
  InvoiceExtraction analyzeInvoice(String prompt);

  /**
   * Analyzes a report prompt.
   *
   * @param prompt the user prompt
   * @return an extraction with bounded word and section counts and every scalar filled
   */
  ReportExtraction analyzeReport(String prompt);

  /** "AI + Regex" when the text generator is active, otherwise "Regex only". */
  String extractionMode();
}
