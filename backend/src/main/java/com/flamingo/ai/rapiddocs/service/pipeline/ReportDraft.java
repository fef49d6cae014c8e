package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import java.nio.file.Path;
import java.util.List;

/**
 * Report analysis result with request overrides applied.
 *
 * @param extraction merged extraction; statistics already include imported and explicit ones
 * @param colors colour scheme for charts and accents
 * @param illustrationPrompts prompts for the illustration stage, already clamped in count
 * @param logoPath resolved logo, null when absent
 */
public record ReportDraft(
    String prompt,
    ReportExtraction extraction,
    List<String> colors,
    List<String> illustrationPrompts,
    Path logoPath,
    boolean includeCover,
    String author) {

  public ReportDraft {
    colors = List.copyOf(colors);
    illustrationPrompts = List.copyOf(illustrationPrompts);
  }
}
