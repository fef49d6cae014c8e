package com.flamingo.ai.rapiddocs.service.pipeline;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Resolution of the optional request fields shared by both document types. */
@Slf4j
final class RequestDefaults {

  private RequestDefaults() {}

  /** First non-empty list wins. */
  @SafeVarargs
  static List<String> colors(List<String>... candidates) {
    for (List<String> candidate : candidates) {
      if (candidate != null && !candidate.isEmpty()) {
        return candidate;
      }
    }
    return List.of();
  }

  /**
   * The logo path when the file exists; otherwise null, with a warning on the job. Invalid paths
   * are treated like missing files.
   */
  static Path logo(String logoPath, GenerationJob job) {
    if (!hasText(logoPath)) {
      return null;
    }
    Path logo;
    try {
      logo = Path.of(logoPath.strip());
    } catch (InvalidPathException e) {
      log.warn("Invalid logo path, rendering without it: {}", e.getMessage());
      job.addWarning("Logo path is invalid");
      return null;
    }
    if (!Files.isRegularFile(logo)) {
      log.warn("Logo not found, rendering without it: {}", logo);
      job.addWarning("Logo not found: " + logo.getFileName());
      return null;
    }
    return logo;
  }

  static String textOr(String value, String fallback) {
    return hasText(value) ? value.strip() : fallback;
  }

  static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
