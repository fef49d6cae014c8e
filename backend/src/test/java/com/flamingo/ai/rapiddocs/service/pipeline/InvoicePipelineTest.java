package com.flamingo.ai.rapiddocs.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.rapiddocs.api.dto.request.InvoiceGenerationRequest;
import com.flamingo.ai.rapiddocs.api.dto.request.LineItemRequest;
import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import com.flamingo.ai.rapiddocs.domain.model.Section;
import com.flamingo.ai.rapiddocs.exception.LlmServiceException;
import com.flamingo.ai.rapiddocs.service.extraction.InvoiceExtractionMerger;
import com.flamingo.ai.rapiddocs.service.extraction.PromptAnalysisService;
import com.flamingo.ai.rapiddocs.service.generation.TextGenerator;
import com.flamingo.ai.rapiddocs.service.importer.CsvDataImporter;
import com.flamingo.ai.rapiddocs.service.invoice.InvoiceTotalsCalculator;
import com.flamingo.ai.rapiddocs.service.render.RenderRequest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvoicePipelineTest {

  private static final String PROMPT = "Invoice Acme Corp for 10 hours of design at $150/hour";

  @Mock private PromptAnalysisService promptAnalysisService;
  @Mock private TextGenerator textGenerator;

  @TempDir Path dir;

  private InvoiceExtraction extraction;
  private InvoicePipeline pipeline;
  private GenerationJob job;

  @BeforeEach
  void setUp() {
    GenerationConfig config = new GenerationConfig();
    config.setOutputDir(dir.toString());
    extraction =
        InvoiceExtraction.builder()
            .invoiceNumber("INV-2024-001")
            .clientName("Acme Corp")
            .clientAddress("1 Main St")
            .vendorName("Studio Nine")
            .vendorAddress("9 Side Rd")
            .currency("USD")
            .paymentTerms("Net 15")
            .notes("Thanks!")
            .lineItems(
                List.of(
                    new LineItemEntry("Design", 10, 150, 0.08),
                    new LineItemEntry("Hosting", 1, 50, 0)))
            .build();
    pipeline =
        new InvoicePipeline(
            promptAnalysisService,
            textGenerator,
            new InvoiceTotalsCalculator(),
            new ImportedDataLoader(List.of(new CsvDataImporter())),
            config);
    job = GenerationJob.start(DocumentType.INVOICE, dir);
  }

  private InvoiceDraft analyze(InvoiceGenerationRequest request) {
    when(promptAnalysisService.analyzeInvoice(request.getPrompt())).thenReturn(extraction);
    return pipeline.analyze(request, job);
  }

  private static InvoiceGenerationRequest.InvoiceGenerationRequestBuilder request() {
    return InvoiceGenerationRequest.builder().prompt(PROMPT);
  }

  private static String body(List<Section> sections, String heading) {
    return sections.stream()
        .filter(section -> section.heading().equals(heading))
        .findFirst()
        .map(Section::body)
        .orElseThrow();
  }

  @Nested
  @DisplayName("Analysis")
  class Analysis {

    @Test
    void shouldKeepExtraction_whenRequestHasNoOverrides() {
      InvoiceDraft draft = analyze(request().build());

      assertThat(draft.extraction()).isEqualTo(extraction);
      assertThat(draft.issueDate()).isEqualTo(LocalDate.now());
      assertThat(draft.dueDate()).isEqualTo(LocalDate.now().plusDays(30));
      assertThat(draft.author()).isEqualTo("Studio Nine");
      assertThat(draft.aiTerms()).isFalse();
      assertThat(draft.aiNotes()).isFalse();
    }

    @Test
    void shouldApplyFieldOverrides() {
      InvoiceDraft draft =
          analyze(
              request()
                  .invoiceNumber(" INV-9 ")
                  .clientName("Globex")
                  .currency("eur")
                  .customTerms("Due on receipt")
                  .customNotes("Merci")
                  .colorScheme(List.of("#112233"))
                  .build());

      InvoiceExtraction resolved = draft.extraction();
      assertThat(resolved.invoiceNumber()).isEqualTo("INV-9");
      assertThat(resolved.clientName()).isEqualTo("Globex");
      assertThat(resolved.clientAddress()).isEqualTo("1 Main St");
      assertThat(resolved.currency()).isEqualTo("EUR");
      assertThat(resolved.paymentTerms()).isEqualTo("Due on receipt");
      assertThat(resolved.notes()).isEqualTo("Merci");
      assertThat(draft.colors()).containsExactly("#112233");
    }

    @Test
    void shouldReplaceLineItems_whenExplicitItemsGiven() {
      LineItemRequest item =
          LineItemRequest.builder()
              .description("Audit")
              .quantity(2.0)
              .unitPrice(300.0)
              .taxRate(0.1)
              .build();

      InvoiceDraft draft = analyze(request().lineItems(List.of(item)).build());

      assertThat(draft.extraction().lineItems())
          .containsExactly(new LineItemEntry("Audit", 2, 300, 0.1));
    }

    @Test
    void shouldAppendImportedLineItems() throws IOException {
      Path csv = dir.resolve("items.csv");
      Files.writeString(csv, "item,qty,rate,tax\nSupport,3,40,20\n,1,1,0\n");

      InvoiceDraft draft = analyze(request().importFilePath(csv.toString()).build());

      assertThat(draft.extraction().lineItems())
          .hasSize(3)
          .last()
          .isEqualTo(new LineItemEntry("Support", 3, 40, 0.2));
    }

    @Test
    void shouldReplaceDefaultLineItems_whenImportedItemsGiven() throws IOException {
      extraction =
          extraction.toBuilder().lineItems(InvoiceExtractionMerger.DEFAULT_LINE_ITEMS).build();
      Path csv = dir.resolve("items.csv");
      Files.writeString(csv, "description,quantity,unit_price\nSupport,3,40\n");

      InvoiceDraft draft = analyze(request().importFilePath(csv.toString()).build());

      assertThat(draft.extraction().lineItems())
          .containsExactly(new LineItemEntry("Support", 3, 40, 0));
    }

    @Test
    void shouldSkipAiTerms_whenCustomTermsGiven() {
      InvoiceDraft draft =
          analyze(
              request()
                  .aiGenerateTerms(true)
                  .aiGenerateNotes(true)
                  .customTerms("Net 60")
                  .build());

      assertThat(draft.aiTerms()).isFalse();
      assertThat(draft.aiNotes()).isTrue();
    }
  }

  @Nested
  @DisplayName("Text generation")
  class TextGeneration {

    @Test
    void shouldBuildInvoiceSectionsWithTotals() {
      InvoiceDraft draft = analyze(request().build());

      List<Section> sections = pipeline.generateText(draft, job);

      assertThat(sections)
          .extracting(Section::heading)
          .containsExactly(
              "Invoice Details",
              "Bill From",
              "Bill To",
              "Line Items",
              "Totals",
              "Payment Terms",
              "Notes");
      assertThat(body(sections, "Invoice Details"))
          .contains("Invoice number: INV-2024-001")
          .contains("Currency: USD");
      assertThat(body(sections, "Bill To")).isEqualTo("Acme Corp\n1 Main St");
      assertThat(body(sections, "Line Items"))
          .isEqualTo(
              "Design: 10 x USD 150.00 = USD 1,500.00 (tax 8%)\n"
                  + "Hosting: 1 x USD 50.00 = USD 50.00");
      assertThat(body(sections, "Totals"))
          .isEqualTo("Subtotal: USD 1,550.00\nTax: USD 120.00\nTotal due: USD 1,670.00");
      assertThat(body(sections, "Payment Terms")).isEqualTo("Net 15");
      assertThat(body(sections, "Notes")).isEqualTo("Thanks!");
      verify(textGenerator, never()).generate(anyString(), anyInt(), anyDouble());
    }

    @Test
    void shouldUseGeneratedTerms_whenRequestedAndActive() {
      InvoiceDraft draft = analyze(request().aiGenerateTerms(true).build());
      when(textGenerator.isActive()).thenReturn(true);
      when(textGenerator.generate(contains("Studio Nine to Acme Corp"), eq(200), eq(0.7)))
          .thenReturn("Pay within two weeks.");

      List<Section> sections = pipeline.generateText(draft, job);

      assertThat(body(sections, "Payment Terms")).isEqualTo("Pay within two weeks.");
      assertThat(job.getWarnings()).isEmpty();
    }

    @Test
    void shouldUseFallbackTerms_whenGeneratorInactive() {
      InvoiceDraft draft = analyze(request().aiGenerateTerms(true).build());
      when(textGenerator.isActive()).thenReturn(false);

      List<Section> sections = pipeline.generateText(draft, job);

      assertThat(body(sections, "Payment Terms")).isEqualTo(InvoicePipeline.FALLBACK_TERMS);
    }

    @Test
    void shouldKeepExtractedNotesAndWarn_whenGenerationFails() {
      InvoiceDraft draft = analyze(request().aiGenerateNotes(true).build());
      when(textGenerator.isActive()).thenReturn(true);
      when(textGenerator.generate(anyString(), anyInt(), anyDouble()))
          .thenThrow(new LlmServiceException("timeout"));

      List<Section> sections = pipeline.generateText(draft, job);

      assertThat(body(sections, "Notes")).isEqualTo("Thanks!");
      assertThat(job.getWarnings()).containsExactly("AI invoice text unavailable: timeout");
    }
  }

  @Test
  void shouldProduceNoVisuals() {
    InvoiceDraft draft = analyze(request().build());

    assertThat(pipeline.generateCharts(draft, job)).isEmpty();
    assertThat(pipeline.generateIllustrations(draft, job)).isEmpty();
  }

  @Test
  void shouldBuildRenderRequestNamedAfterInvoiceNumber() {
    InvoiceDraft draft = analyze(request().build());

    RenderRequest renderRequest =
        pipeline.renderRequest(draft, List.of(), List.of(), List.of(), job);

    assertThat(renderRequest.title()).isEqualTo("Invoice INV-2024-001");
    assertThat(renderRequest.includeCover()).isFalse();
    assertThat(renderRequest.outputPath().getFileName().toString())
        .isEqualTo("invoice_" + job.getJobId() + "_INV-2024-001.pdf");
    assertThat(renderRequest.metadata()).containsEntry("Client", "Acme Corp");
  }
}
