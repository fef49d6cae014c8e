package com.flamingo.ai.rapiddocs.domain.model;

import java.util.List;
import lombok.Builder;

/**
 * Structured report data extracted from a prompt.
 *
 * <p>{@code wordCount} and {@code sectionCount} are 0 when unknown; the default-fill step replaces
 * them with bounded values.
 */
@Builder(toBuilder = true)
public record ReportExtraction(
    String title,
    String topic,
    String tone,
    String date,
    int wordCount,
    int sectionCount,
    List<StatisticEntry> statistics,
    List<String> imagePrompts,
    List<String> sectionOutlines,
    List<String> colorSuggestions) {

  public ReportExtraction {
    title = title == null ? "" : title;
    topic = topic == null ? "" : topic;
    tone = tone == null ? "" : tone;
    date = date == null ? "" : date;
    statistics = statistics == null ? List.of() : List.copyOf(statistics);
    imagePrompts = imagePrompts == null ? List.of() : List.copyOf(imagePrompts);
    sectionOutlines = sectionOutlines == null ? List.of() : List.copyOf(sectionOutlines);
    colorSuggestions = colorSuggestions == null ? List.of() : List.copyOf(colorSuggestions);
  }

  /** An extraction with every field empty. */
  public static ReportExtraction empty() {
    return ReportExtraction.builder().build();
  }
}
