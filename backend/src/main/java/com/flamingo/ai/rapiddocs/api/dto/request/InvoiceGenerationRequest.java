package com.flamingo.ai.rapiddocs.api.dto.request;

import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for generating an invoice. Explicit fields override what is extracted from the
 * prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceGenerationRequest implements GenerationRequest {

  @NotBlank(message = "Prompt is required")
  @Size(max = 10000, message = "Prompt must not exceed 10000 characters")
  private String prompt;

  @Size(max = 50, message = "Invoice number must not exceed 50 characters")
  private String invoiceNumber;

  @Size(max = 200, message = "Client name must not exceed 200 characters")
  private String clientName;

  @Size(max = 500, message = "Client address must not exceed 500 characters")
  private String clientAddress;

  @Size(max = 200, message = "Vendor name must not exceed 200 characters")
  private String vendorName;

  @Size(max = 500, message = "Vendor address must not exceed 500 characters")
  private String vendorAddress;

  /** Replace the extracted line items when non-empty. */
  @Valid @Builder.Default private List<LineItemRequest> lineItems = new ArrayList<>();

  @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter code")
  private String currency;

  @Size(max = 2000, message = "Terms must not exceed 2000 characters")
  private String customTerms;

  @Size(max = 2000, message = "Notes must not exceed 2000 characters")
  private String customNotes;

  private boolean aiGenerateTerms;

  private boolean aiGenerateNotes;

  private List<
          @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "Colors must be hex codes like #1e40af")
          String>
      colorScheme;

  private String logoPath;

  private String importFilePath;

  private String author;

  @Override
  public DocumentType getDocumentType() {
    return DocumentType.INVOICE;
  }
}
