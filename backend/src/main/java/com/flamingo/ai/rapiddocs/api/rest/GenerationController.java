package com.flamingo.ai.rapiddocs.api.rest;

import com.flamingo.ai.rapiddocs.api.dto.request.InvoiceGenerationRequest;
import com.flamingo.ai.rapiddocs.api.dto.request.ReportGenerationRequest;
import com.flamingo.ai.rapiddocs.api.dto.response.GenerationResponse;
import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.exception.GeneratedFileNotFoundException;
import com.flamingo.ai.rapiddocs.service.pipeline.GenerationOrchestrator;
import jakarta.validation.Valid;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document generation and download of the generated files. */
@RestController
@RequestMapping("/api/generate")
@RequiredArgsConstructor
@Slf4j
public class GenerationController {

  private final GenerationOrchestrator generationOrchestrator;
  private final GenerationConfig generationConfig;

  /** Generates an illustrated report. Runs synchronously. */
  @PostMapping("/report")
  public ResponseEntity<GenerationResponse> generateReport(
      @Valid @RequestBody ReportGenerationRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(GenerationResponse.fromResult(generationOrchestrator.execute(request)));
  }

  /** Generates an invoice. Runs synchronously. */
  @PostMapping("/invoice")
  public ResponseEntity<GenerationResponse> generateInvoice(
      @Valid @RequestBody InvoiceGenerationRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(GenerationResponse.fromResult(generationOrchestrator.execute(request)));
  }

  /**
   * Downloads a generated PDF.
   *
   * @param fileName plain file name as returned in {@link GenerationResponse#getFileName()}
   * @return the PDF as an attachment, or 404 for unknown or out-of-directory names
   */
  @GetMapping("/files/{fileName:.+}")
  public ResponseEntity<Resource> downloadFile(@PathVariable String fileName) {
    Path file = resolveGeneratedFile(fileName);
    log.debug("Serving generated file {}", file.getFileName());
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_PDF)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(fileName).build().toString())
        .body(new FileSystemResource(file));
  }

  private Path resolveGeneratedFile(String fileName) {
    if (fileName.contains("/") || fileName.contains("\\") || !fileName.endsWith(".pdf")) {
      throw new GeneratedFileNotFoundException(fileName);
    }
    Path root = Path.of(generationConfig.getOutputDir()).toAbsolutePath().normalize();
    Path file = root.resolve(fileName).normalize();
    if (!file.getParent().equals(root) || !Files.isRegularFile(file)) {
      throw new GeneratedFileNotFoundException(fileName);
    }
    return file;
  }
}
