package com.flamingo.ai.rapiddocs.service.extraction;

import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;
import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import com.flamingo.ai.rapiddocs.service.extraction.dto.ReportExtractionPayload;
import com.flamingo.ai.rapiddocs.service.generation.TextGenerator;
import dev.langchain4j.model.input.PromptTemplate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Extracts report parameters and statistics through a structured-output model call. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportAiExtractor implements AiExtractor<ReportExtraction> {

  private static final PromptTemplate EXTRACTION_PROMPT =
      PromptTemplate.from(
          """
          You are an expert document analyzer. Analyze the following user prompt for generating
          an illustrated report and extract structured information.

          USER PROMPT:
          {{prompt}}

          Return a JSON object with these fields:
          - title (string): a clear, professional document title
          - topic (string): the main subject matter
          - word_count (integer): target word count ("X words"; "brief"/"short" = 300-500;
            "detailed"/"comprehensive" = 1000-2000; 500 if not specified)
          - num_sections (integer): number of sections, typically 3-5
          - tone (string): one of professional, academic, business, formal
          - statistics (array of objects): name (string), value (number), unit (string, e.g. %,
            USD, items), visualization_type (one of bar_chart, line_chart, pie_chart,
            gauge_chart, number), category (string, optional), description (string, optional)
          - image_prompts (array of strings): 3-4 specific, visually descriptive illustration
            prompts that complement the sections
          - section_outlines (array of strings): a short title for each section
          - color_suggestions (array of strings): 3 hex colour codes matching the topic

          Visualization choice:
          - bar_chart for comparisons between categories
          - line_chart for trends over time
          - pie_chart for parts of a whole
          - gauge_chart for a single percentage or progress value
          - number for a standalone important figure
          """);

  private final TextGenerator textGenerator;
  private final GenerationConfig generationConfig;

  @Override
  public ReportExtraction extract(String prompt) {
    if (!textGenerator.isActive()) {
      log.debug("Text generator inactive, skipping AI report extraction");
      return ReportExtraction.empty();
    }
    try {
      String instruction =
          EXTRACTION_PROMPT.apply(Map.of("prompt", prompt == null ? "" : prompt)).text();
      ReportExtractionPayload payload =
          textGenerator.generateStructured(
              instruction,
              ReportExtractionPayload.class,
              generationConfig.getExtraction().getMaxTokens());
      ReportExtraction result = toExtraction(payload);
      log.debug(
          "AI extracted: title='{}', sections={}, statistics={}",
          result.title(),
          result.sectionCount(),
          result.statistics().size());
      return result;
    } catch (RuntimeException e) {
      log.warn("AI report extraction failed, continuing with regex result: {}", e.getMessage());
      return ReportExtraction.empty();
    }
  }

  static ReportExtraction toExtraction(ReportExtractionPayload payload) {
    List<StatisticEntry> statistics =
        payload.statistics() == null
            ? List.of()
            : payload.statistics().stream()
                .filter(Objects::nonNull)
                .map(ReportAiExtractor::toStatistic)
                .toList();

    return ReportExtraction.builder()
        .title(trim(payload.title()))
        .topic(trim(payload.topic()))
        .tone(trim(payload.tone()))
        .wordCount(payload.wordCount() != null ? payload.wordCount() : 0)
        .sectionCount(payload.numSections() != null ? payload.numSections() : 0)
        .statistics(statistics)
        .imagePrompts(nonBlank(payload.imagePrompts()))
        .sectionOutlines(nonBlank(payload.sectionOutlines()))
        .colorSuggestions(nonBlank(payload.colorSuggestions()))
        .build();
  }

  private static StatisticEntry toStatistic(ReportExtractionPayload.Statistic stat) {
    String name = trim(stat.name());
    String unit = trim(stat.unit());
    return new StatisticEntry(
        name.isEmpty() ? "Statistic" : name,
        stat.value() != null ? stat.value() : 0,
        unit.isEmpty() ? "units" : unit,
        VisualizationType.fromName(stat.visualizationType()),
        stat.category(),
        stat.description());
  }

  private static List<String> nonBlank(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .toList();
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
