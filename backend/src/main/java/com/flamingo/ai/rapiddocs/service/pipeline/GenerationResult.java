package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.enums.GenerationStage;
import com.flamingo.ai.rapiddocs.domain.enums.StageStatus;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/** Outcome of a completed generation job. */
@Builder
public record GenerationResult(
    String jobId,
    DocumentType documentType,
    String title,
    Path outputPath,
    int sectionCount,
    int chartCount,
    int illustrationCount,
    Map<GenerationStage, StageStatus> stages,
    List<String> warnings) {

  public boolean isDegraded() {
    return !warnings.isEmpty();
  }
}
