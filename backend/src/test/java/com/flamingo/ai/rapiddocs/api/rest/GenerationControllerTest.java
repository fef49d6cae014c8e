package com.flamingo.ai.rapiddocs.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.rapiddocs.api.dto.request.GenerationRequest;
import com.flamingo.ai.rapiddocs.api.dto.request.InvoiceGenerationRequest;
import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.enums.GenerationStage;
import com.flamingo.ai.rapiddocs.domain.enums.StageStatus;
import com.flamingo.ai.rapiddocs.exception.CriticalStageException;
import com.flamingo.ai.rapiddocs.exception.DataImportException;
import com.flamingo.ai.rapiddocs.exception.GenerationValidationException;
import com.flamingo.ai.rapiddocs.exception.GlobalExceptionHandler;
import com.flamingo.ai.rapiddocs.exception.LlmServiceException;
import com.flamingo.ai.rapiddocs.service.pipeline.GenerationOrchestrator;
import com.flamingo.ai.rapiddocs.service.pipeline.GenerationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class GenerationControllerTest {

  @Mock private GenerationOrchestrator generationOrchestrator;

  @TempDir Path outputDir;

  private SimpleMeterRegistry meterRegistry;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    GenerationConfig config = new GenerationConfig();
    config.setOutputDir(outputDir.toString());
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new GenerationController(generationOrchestrator, config))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  private GenerationResult result(DocumentType type, String fileName, List<String> warnings) {
    Map<GenerationStage, StageStatus> stages = new EnumMap<>(GenerationStage.class);
    for (GenerationStage stage : GenerationStage.values()) {
      stages.put(stage, StageStatus.COMPLETED);
    }
    return GenerationResult.builder()
        .jobId("ab12cd34")
        .documentType(type)
        .title("Solar Outlook")
        .outputPath(outputDir.resolve(fileName))
        .sectionCount(3)
        .chartCount(2)
        .illustrationCount(3)
        .stages(stages)
        .warnings(warnings)
        .build();
  }

  @Nested
  @DisplayName("POST /api/generate/report")
  class GenerateReport {

    @Test
    void shouldReturnCreatedWithDownloadUrl() throws Exception {
      // Given
      when(generationOrchestrator.execute(any(GenerationRequest.class)))
          .thenReturn(
              result(
                  DocumentType.REPORT,
                  "infographic_ab12cd34_Solar_Outlook.pdf",
                  List.of("Text generator inactive: report body uses template text")));

      // When / Then
      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":\"Solar outlook with 3 images\",\"numImages\":3}"))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.jobId").value("ab12cd34"))
          .andExpect(jsonPath("$.documentType").value("REPORT"))
          .andExpect(jsonPath("$.fileName").value("infographic_ab12cd34_Solar_Outlook.pdf"))
          .andExpect(
              jsonPath("$.downloadUrl")
                  .value("/api/generate/files/infographic_ab12cd34_Solar_Outlook.pdf"))
          .andExpect(jsonPath("$.chartCount").value(2))
          .andExpect(jsonPath("$.stages.RENDER").value("COMPLETED"))
          .andExpect(jsonPath("$.warnings[0]").value(containsString("template text")));
    }

    @Test
    void shouldReturnBadRequest_whenPromptIsBlank() throws Exception {
      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":\"\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"))
          .andExpect(jsonPath("$.details[0]").value("prompt: Prompt is required"));

      verify(generationOrchestrator, never()).execute(any());
      assertThat(
              meterRegistry.counter("api_errors_total", "error_type", "validation_error").count())
          .isEqualTo(1.0);
    }

    @Test
    void shouldReturnBadRequest_whenBodyIsMalformed() throws Exception {
      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    }

    @Test
    void shouldReturnBadRequest_whenOrchestratorRejectsRequest() throws Exception {
      when(generationOrchestrator.execute(any(GenerationRequest.class)))
          .thenThrow(
              new GenerationValidationException(
                  List.of("importFilePath: file not found: missing.csv")));

      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":\"Report\",\"importFilePath\":\"missing.csv\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("importFilePath: file not found: missing.csv"));
    }

    @Test
    void shouldReturnBadGateway_whenTextStageFailsOnProvider() throws Exception {
      when(generationOrchestrator.execute(any(GenerationRequest.class)))
          .thenThrow(
              new CriticalStageException(
                  GenerationStage.GENERATE_TEXT,
                  "ab12cd34",
                  new LlmServiceException("provider down")));

      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":\"Report\"}"))
          .andExpect(status().isBadGateway())
          .andExpect(jsonPath("$.code").value("LLM_001"))
          .andExpect(jsonPath("$.jobId").value("ab12cd34"));
    }

    @Test
    void shouldReturnTooManyRequests_whenProviderRateLimits() throws Exception {
      // Given
      when(generationOrchestrator.execute(any(GenerationRequest.class)))
          .thenThrow(
              new CriticalStageException(
                  GenerationStage.GENERATE_TEXT,
                  "ab12cd34",
                  new LlmServiceException(
                      "Text generation call failed",
                      new RuntimeException("HTTP 429 Too Many Requests"))));

      // When / Then
      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":\"Report\"}"))
          .andExpect(status().isTooManyRequests())
          .andExpect(jsonPath("$.code").value("LLM_002"))
          .andExpect(
              jsonPath("$.message")
                  .value("Service is temporarily busy. Please try again in a moment."))
          .andExpect(jsonPath("$.jobId").value("ab12cd34"));
    }

    @Test
    void shouldReturnUnprocessable_whenImportFailsDuringAnalysis() throws Exception {
      when(generationOrchestrator.execute(any(GenerationRequest.class)))
          .thenThrow(
              new CriticalStageException(
                  GenerationStage.ANALYZE,
                  "ab12cd34",
                  new DataImportException(Path.of("data.csv"), "Import file has no header row")));

      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":\"Report\",\"importFilePath\":\"data.csv\"}"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value("IMPORT_001"));
    }

    @Test
    void shouldReturnServerError_whenRenderFails() throws Exception {
      when(generationOrchestrator.execute(any(GenerationRequest.class)))
          .thenThrow(
              new CriticalStageException(
                  GenerationStage.RENDER, "ab12cd34", new IOException("disk full")));

      mockMvc
          .perform(
              post("/api/generate/report")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"prompt\":\"Report\"}"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.code").value("GENERATION_001"));
    }
  }

  @Nested
  @DisplayName("POST /api/generate/invoice")
  class GenerateInvoice {

    @Test
    void shouldBindInvoiceFields() throws Exception {
      when(generationOrchestrator.execute(any(GenerationRequest.class)))
          .thenReturn(result(DocumentType.INVOICE, "invoice_ab12cd34_INV-7.pdf", List.of()));

      mockMvc
          .perform(
              post("/api/generate/invoice")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"prompt\":\"Invoice Acme\",\"invoiceNumber\":\"INV-7\","
                          + "\"currency\":\"eur\",\"aiGenerateTerms\":true,"
                          + "\"lineItems\":[{\"description\":\"Audit\",\"quantity\":2,"
                          + "\"unitPrice\":300}]}"))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.documentType").value("INVOICE"));

      ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
      verify(generationOrchestrator).execute(captor.capture());
      assertThat(captor.getValue())
          .isInstanceOfSatisfying(
              InvoiceGenerationRequest.class,
              request -> {
                assertThat(request.getInvoiceNumber()).isEqualTo("INV-7");
                assertThat(request.isAiGenerateTerms()).isTrue();
                assertThat(request.getCurrency()).isEqualTo("eur");
                assertThat(request.getLineItems())
                    .singleElement()
                    .satisfies(item -> assertThat(item.getUnitPrice()).isEqualTo(300.0));
              });
    }

    @Test
    void shouldRejectInvalidLineItem() throws Exception {
      mockMvc
          .perform(
              post("/api/generate/invoice")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"prompt\":\"Invoice\",\"lineItems\":[{\"description\":\"Audit\","
                          + "\"quantity\":0,\"unitPrice\":10,\"taxRate\":1.5}]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.details.length()").value(2));

      verify(generationOrchestrator, never()).execute(any());
    }
  }

  @Nested
  @DisplayName("GET /api/generate/files/{fileName}")
  class DownloadFile {

    @Test
    void shouldServeGeneratedPdf() throws Exception {
      Files.write(outputDir.resolve("invoice_ab12cd34_INV-7.pdf"), new byte[] {'%', 'P', 'D', 'F'});

      mockMvc
          .perform(get("/api/generate/files/invoice_ab12cd34_INV-7.pdf"))
          .andExpect(status().isOk())
          .andExpect(content().contentType(MediaType.APPLICATION_PDF))
          .andExpect(header().string("Content-Disposition", containsString("attachment")))
          .andExpect(content().bytes(new byte[] {'%', 'P', 'D', 'F'}));
    }

    @Test
    void shouldReturnNotFound_whenFileIsMissing() throws Exception {
      mockMvc
          .perform(get("/api/generate/files/missing.pdf"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value("FILE_001"));
    }

    @Test
    void shouldReturnNotFound_whenNameIsNotPdf() throws Exception {
      Files.writeString(outputDir.resolve("notes.txt"), "secret");

      mockMvc.perform(get("/api/generate/files/notes.txt")).andExpect(status().isNotFound());
    }

    @Test
    void shouldReturnNotFound_whenNameEscapesOutputDirectory() throws Exception {
      mockMvc
          .perform(get(URI.create("/api/generate/files/..%5Csecret.pdf")))
          .andExpect(status().isNotFound());
    }
  }
}
