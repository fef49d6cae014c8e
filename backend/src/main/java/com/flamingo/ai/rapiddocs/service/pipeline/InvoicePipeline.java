package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.api.dto.request.InvoiceGenerationRequest;
import com.flamingo.ai.rapiddocs.api.dto.request.LineItemRequest;
import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import com.flamingo.ai.rapiddocs.domain.model.Section;
import com.flamingo.ai.rapiddocs.service.extraction.InvoiceExtractionMerger;
import com.flamingo.ai.rapiddocs.service.extraction.PromptAnalysisService;
import com.flamingo.ai.rapiddocs.service.generation.TextGenerator;
import com.flamingo.ai.rapiddocs.service.importer.ImportedRecord;
import com.flamingo.ai.rapiddocs.service.invoice.InvoiceTotals;
import com.flamingo.ai.rapiddocs.service.invoice.InvoiceTotalsCalculator;
import com.flamingo.ai.rapiddocs.service.render.RenderRequest;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Invoice: parties, line items and totals as text sections. No charts or illustrations. */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoicePipeline implements DocumentPipeline<InvoiceGenerationRequest, InvoiceDraft> {

  static final String FALLBACK_TERMS =
      "Payment is due within 30 days of invoice date. Late payments may incur a 2% monthly"
          + " interest charge. Please reference the invoice number when making payment.";

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);
  private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ROOT);

  private final PromptAnalysisService promptAnalysisService;
  private final TextGenerator textGenerator;
  private final InvoiceTotalsCalculator totalsCalculator;
  private final ImportedDataLoader importedDataLoader;
  private final GenerationConfig generationConfig;

  @Override
  public DocumentType documentType() {
    return DocumentType.INVOICE;
  }

  @Override
  public Class<InvoiceGenerationRequest> requestType() {
    return InvoiceGenerationRequest.class;
  }

  @Override
  public List<String> validate(InvoiceGenerationRequest request) {
    List<String> errors = new ArrayList<>();
    importedDataLoader.check(request.getImportFilePath()).ifPresent(errors::add);
    return errors;
  }

  @Override
  public InvoiceDraft analyze(InvoiceGenerationRequest request, GenerationJob job) {
    InvoiceExtraction extraction = promptAnalysisService.analyzeInvoice(request.getPrompt());

    InvoiceExtraction resolved =
        extraction.toBuilder()
            .invoiceNumber(
                RequestDefaults.textOr(request.getInvoiceNumber(), extraction.invoiceNumber()))
            .clientName(RequestDefaults.textOr(request.getClientName(), extraction.clientName()))
            .clientAddress(
                RequestDefaults.textOr(request.getClientAddress(), extraction.clientAddress()))
            .vendorName(RequestDefaults.textOr(request.getVendorName(), extraction.vendorName()))
            .vendorAddress(
                RequestDefaults.textOr(request.getVendorAddress(), extraction.vendorAddress()))
            .currency(
                RequestDefaults.textOr(request.getCurrency(), extraction.currency())
                    .toUpperCase(Locale.ROOT))
            .paymentTerms(
                RequestDefaults.textOr(request.getCustomTerms(), extraction.paymentTerms()))
            .notes(RequestDefaults.textOr(request.getCustomNotes(), extraction.notes()))
            .lineItems(
                resolveLineItems(
                    extraction.lineItems(),
                    request.getLineItems(),
                    importedDataLoader.load(request.getImportFilePath())))
            .build();

    return new InvoiceDraft(
        resolved,
        request.getPrompt(),
        RequestDefaults.colors(request.getColorScheme(), generationConfig.getDefaultColors()),
        RequestDefaults.logo(request.getLogoPath(), job),
        LocalDate.now(),
        request.isAiGenerateTerms() && !RequestDefaults.hasText(request.getCustomTerms()),
        request.isAiGenerateNotes() && !RequestDefaults.hasText(request.getCustomNotes()),
        RequestDefaults.textOr(request.getAuthor(), resolved.vendorName()));
  }

  @Override
  public List<Section> generateText(InvoiceDraft draft, GenerationJob job) {
    InvoiceExtraction invoice = draft.extraction();
    InvoiceTotals totals = totalsCalculator.calculate(invoice.lineItems());

    String terms = invoice.paymentTerms();
    if (draft.aiTerms()) {
      terms = aiText(termsPrompt(draft), FALLBACK_TERMS, job);
    }
    String notes = invoice.notes();
    if (draft.aiNotes()) {
      notes = aiText(notesPrompt(draft), notes, job);
    }

    List<Section> sections = new ArrayList<>();
    sections.add(
        new Section(
            "Invoice Details",
            "Invoice number: "
                + invoice.invoiceNumber()
                + "\nIssue date: "
                + draft.issueDate().format(DATE_FORMAT)
                + "\nDue date: "
                + draft.dueDate().format(DATE_FORMAT)
                + "\nCurrency: "
                + invoice.currency()));
    sections.add(new Section("Bill From", invoice.vendorName() + "\n" + invoice.vendorAddress()));
    sections.add(new Section("Bill To", invoice.clientName() + "\n" + invoice.clientAddress()));
    sections.add(new Section("Line Items", lineItemText(totals, invoice.currency())));
    sections.add(new Section("Totals", totalsText(totals, invoice.currency())));
    sections.add(new Section("Payment Terms", terms));
    sections.add(new Section("Notes", notes));
    return sections;
  }

  @Override
  public List<Path> generateCharts(InvoiceDraft draft, GenerationJob job) {
    return List.of();
  }

  @Override
  public List<Path> generateIllustrations(InvoiceDraft draft, GenerationJob job) {
    return List.of();
  }

  @Override
  public RenderRequest renderRequest(
      InvoiceDraft draft,
      List<Section> sections,
      List<Path> charts,
      List<Path> illustrations,
      GenerationJob job) {
    InvoiceExtraction invoice = draft.extraction();
    String title = "Invoice " + invoice.invoiceNumber();
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("Author", draft.author());
    metadata.put("Client", invoice.clientName());
    return RenderRequest.builder()
        .title(title)
        .sections(sections)
        .chartPaths(charts)
        .illustrationPaths(illustrations)
        .outputPath(job.outputFile(invoice.invoiceNumber()))
        .logoPath(draft.logoPath())
        .includeCover(false)
        .metadata(metadata)
        .colors(draft.colors())
        .build();
  }

  /**
   * Explicit items replace everything else. Imported items are appended to the extracted ones,
   * or replace them when the extraction only holds the generic defaults.
   */
  static List<LineItemEntry> resolveLineItems(
      List<LineItemEntry> extracted,
      List<LineItemRequest> explicit,
      List<ImportedRecord> imported) {
    if (explicit != null && !explicit.isEmpty()) {
      return explicit.stream().map(item -> item.toEntry().normalized()).toList();
    }
    List<LineItemEntry> importedItems =
        imported.stream()
            .map(ImportedRecord::toLineItem)
            .filter(item -> !item.description().isBlank())
            .map(LineItemEntry::normalized)
            .toList();
    if (importedItems.isEmpty()) {
      return extracted;
    }
    List<LineItemEntry> combined = new ArrayList<>();
    if (!extracted.equals(InvoiceExtractionMerger.DEFAULT_LINE_ITEMS)) {
      combined.addAll(extracted);
    }
    combined.addAll(importedItems);
    return combined;
  }

  private String aiText(String prompt, String fallback, GenerationJob job) {
    if (!textGenerator.isActive()) {
      log.info("Text generator inactive, keeping default invoice text");
      return fallback;
    }
    try {
      return textGenerator.generate(
          prompt,
          generationConfig.getText().getShortTextMaxTokens(),
          generationConfig.getText().getTemperature());
    } catch (RuntimeException e) {
      log.warn("AI invoice text failed, using default: {}", e.getMessage());
      job.addWarning("AI invoice text unavailable: " + e.getMessage());
      return fallback;
    }
  }

  private static String termsPrompt(InvoiceDraft draft) {
    return "Write concise, professional payment terms (2-3 sentences) for an invoice from "
        + draft.extraction().vendorName()
        + " to "
        + draft.extraction().clientName()
        + ". Context: "
        + draft.prompt()
        + "\nReturn only the terms text.";
  }

  private static String notesPrompt(InvoiceDraft draft) {
    return "Write a short, friendly closing note (1-2 sentences) for an invoice from "
        + draft.extraction().vendorName()
        + " to "
        + draft.extraction().clientName()
        + ". Context: "
        + draft.prompt()
        + "\nReturn only the note text.";
  }

  static String lineItemText(InvoiceTotals totals, String currency) {
    DecimalFormat quantity = new DecimalFormat("#,##0.##", SYMBOLS);
    StringBuilder text = new StringBuilder();
    for (InvoiceTotals.LineTotal line : totals.lines()) {
      text.append(line.description())
          .append(": ")
          .append(quantity.format(line.quantity()))
          .append(" x ")
          .append(money(line.unitPrice(), currency))
          .append(" = ")
          .append(money(line.amount(), currency));
      if (line.taxRate().signum() > 0) {
        text.append(" (tax ")
            .append(quantity.format(line.taxRate().movePointRight(2)))
            .append("%)");
      }
      text.append('\n');
    }
    return text.toString().strip();
  }

  static String totalsText(InvoiceTotals totals, String currency) {
    return "Subtotal: "
        + money(totals.subtotal(), currency)
        + "\nTax: "
        + money(totals.tax(), currency)
        + "\nTotal due: "
        + money(totals.total(), currency);
  }

  static String money(BigDecimal amount, String currency) {
    return currency + " " + new DecimalFormat("#,##0.00", SYMBOLS).format(amount);
  }
}
