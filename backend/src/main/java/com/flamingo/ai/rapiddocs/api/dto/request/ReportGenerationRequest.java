package com.flamingo.ai.rapiddocs.api.dto.request;

import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating an illustrated report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportGenerationRequest implements GenerationRequest {

  @NotBlank(message = "Prompt is required")
  @Size(max = 10000, message = "Prompt must not exceed 10000 characters")
  private String prompt;

  /** Overrides the extracted title. */
  @Size(max = 200, message = "Title must not exceed 200 characters")
  private String title;

  /** Appended to the statistics extracted from the prompt. */
  @Valid @Builder.Default private List<StatisticRequest> statistics = new ArrayList<>();

  @Min(value = 1, message = "Number of sections must be at least 1")
  @Max(value = 20, message = "Number of sections must be at most 20")
  private Integer numSections;

  /** Clamped to 2-4. */
  @Min(value = 0, message = "Number of images must not be negative")
  @Max(value = 10, message = "Number of images must be at most 10")
  private Integer numImages;

  /** Explicit text length; clamped to 100-10000. */
  @Min(value = 1, message = "Word count must be positive")
  private Integer wordCount;

  private List<
          @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "Colors must be hex codes like #1e40af")
          String>
      colorScheme;

  private String logoPath;

  private String importFilePath;

  @Builder.Default private Boolean includeCoverPage = true;

  private String author;

  @Override
  public DocumentType getDocumentType() {
    return DocumentType.REPORT;
  }
}
