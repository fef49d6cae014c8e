package com.flamingo.ai.rapiddocs.api.dto.response;

import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.enums.GenerationStage;
import com.flamingo.ai.rapiddocs.domain.enums.StageStatus;
import com.flamingo.ai.rapiddocs.service.pipeline.GenerationResult;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed generation job. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResponse {

  private String jobId;
  private DocumentType documentType;
  private String title;

  /** Name to pass to the file download endpoint. */
  private String fileName;

  private String downloadUrl;
  private int sectionCount;
  private int chartCount;
  private int illustrationCount;
  private Map<GenerationStage, StageStatus> stages;
  private List<String> warnings;

  public static GenerationResponse fromResult(GenerationResult result) {
    String fileName = result.outputPath().getFileName().toString();
    return GenerationResponse.builder()
        .jobId(result.jobId())
        .documentType(result.documentType())
        .title(result.title())
        .fileName(fileName)
        .downloadUrl("/api/generate/files/" + fileName)
        .sectionCount(result.sectionCount())
        .chartCount(result.chartCount())
        .illustrationCount(result.illustrationCount())
        .stages(result.stages())
        .warnings(result.warnings())
        .build();
  }
}
