package com.flamingo.ai.rapiddocs.service.extraction;

import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import com.flamingo.ai.rapiddocs.service.generation.TextGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Regex extraction always runs as the baseline; the AI extractor enhances it when the generator is
 * active and yields an empty result otherwise, so the merge step runs unconditionally.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptAnalysisServiceImpl implements PromptAnalysisService {

  private final TextGenerator textGenerator;
  private final RegexExtractor<InvoiceExtraction> invoiceRegexExtractor;
  private final AiExtractor<InvoiceExtraction> invoiceAiExtractor;
  private final ExtractionMerger<InvoiceExtraction> invoiceExtractionMerger;
  private final RegexExtractor<ReportExtraction> reportRegexExtractor;
  private final AiExtractor<ReportExtraction> reportAiExtractor;
  private final ExtractionMerger<ReportExtraction> reportExtractionMerger;

  @Override
  public InvoiceExtraction analyzeInvoice(String prompt) {
    log.info("Analyzing invoice prompt ({} chars, mode={})", length(prompt), extractionMode());
    InvoiceExtraction regex = invoiceRegexExtractor.extract(prompt);
    InvoiceExtraction ai = invoiceAiExtractor.extract(prompt);
    InvoiceExtraction result = invoiceExtractionMerger.merge(ai, regex);

    log.info(
        "Invoice extraction: number={}, vendor='{}', client='{}', currency={}, items={}",
        result.invoiceNumber(),
        result.vendorName(),
        result.clientName(),
        result.currency(),
        result.lineItems().size());
    return result;
  }

  @Override
  public ReportExtraction analyzeReport(String prompt) {
    log.info("Analyzing report prompt ({} chars, mode={})", length(prompt), extractionMode());
    ReportExtraction regex = reportRegexExtractor.extract(prompt);
    ReportExtraction ai = reportAiExtractor.extract(prompt);
    ReportExtraction result = reportExtractionMerger.merge(ai, regex);

    log.info(
        "Report extraction: title='{}', words={}, sections={}, statistics={}, imagePrompts={}",
        result.title(),
        result.wordCount(),
        result.sectionCount(),
        result.statistics().size(),
        result.imagePrompts().size());
    return result;
  }

  @Override
  public String extractionMode() {
    return textGenerator.isActive() ? "AI + Regex" : "Regex only";
  }

  private static int length(String prompt) {
    return prompt == null ? 0 : prompt.length();
  }
}
