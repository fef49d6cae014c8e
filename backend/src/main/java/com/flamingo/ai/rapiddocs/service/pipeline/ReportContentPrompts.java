package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import dev.langchain4j.model.input.PromptTemplate;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Prompt and offline template for report body text. */
final class ReportContentPrompts {

  private static final PromptTemplate CONTENT_PROMPT =
      PromptTemplate.from(
          """
          You are a professional writer creating content for an illustrated report.

          ORIGINAL REQUEST:
          {{prompt}}

          REQUIREMENTS:
          - Title: {{title}}
          - Topic: {{topic}}
          - Target length: approximately {{wordCount}} words
          - Number of sections: {{sectionCount}}
          - Tone: {{tone}}

          SECTION OUTLINE:
          {{outline}}

          KEY STATISTICS TO REFERENCE:
          {{statistics}}

          WRITING RULES:
          - Write flowing paragraphs. Do not use bullet points or markdown.
          - When listing items inside a paragraph, enumerate them with numbers (1, 2, 3),
            letters (a, b, c) or roman numerals (i, ii, iii).
          - Start each section on a new line with its number and title, e.g. "1. Introduction".
          - Weave the statistics naturally into the text.
          - Match the requested tone and stay close to the target length.
          """);

  private ReportContentPrompts() {}

  static String contentPrompt(String prompt, ReportExtraction extraction) {
    Map<String, Object> variables = new HashMap<>();
    variables.put("prompt", prompt);
    variables.put("title", extraction.title());
    variables.put("topic", extraction.topic());
    variables.put("wordCount", extraction.wordCount());
    variables.put("sectionCount", extraction.sectionCount());
    variables.put("tone", extraction.tone());
    variables.put("outline", numberedOutline(extraction.sectionOutlines()));
    variables.put("statistics", statisticLines(extraction.statistics()));
    return CONTENT_PROMPT.apply(variables).text();
  }

  /**
   * Body text used when no text generator is available. Numbered headings so that the segmenter
   * splits it back into one section per outline entry.
   */
  static String templateText(ReportExtraction extraction) {
    List<String> outline = extraction.sectionOutlines();
    List<StatisticEntry> statistics = extraction.statistics();
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < extraction.sectionCount(); i++) {
      String heading = i < outline.size() ? outline.get(i) : "Section " + (i + 1);
      text.append(i + 1).append(". ").append(heading).append('\n');
      text.append("This section covers ")
          .append(heading.toLowerCase(Locale.ROOT))
          .append(" as part of this report on ")
          .append(extraction.topic())
          .append(". ");
      if (i < statistics.size()) {
        StatisticEntry stat = statistics.get(i);
        text.append("A key figure here is ")
            .append(stat.name())
            .append(" at ")
            .append(formatValue(stat))
            .append(", which frames the discussion that follows. ");
      }
      text.append(
          "It summarizes the current situation and the main factors shaping it.\n\n");
    }
    return text.toString().strip();
  }

  static String numberedOutline(List<String> outline) {
    StringBuilder lines = new StringBuilder();
    for (int i = 0; i < outline.size(); i++) {
      lines.append(i + 1).append(". ").append(outline.get(i)).append('\n');
    }
    return lines.toString().strip();
  }

  static String statisticLines(List<StatisticEntry> statistics) {
    if (statistics.isEmpty()) {
      return "None specified";
    }
    StringBuilder lines = new StringBuilder();
    for (StatisticEntry stat : statistics) {
      lines.append("- ").append(stat.name()).append(": ").append(formatValue(stat)).append('\n');
    }
    return lines.toString().strip();
  }

  private static String formatValue(StatisticEntry stat) {
    String value =
        new DecimalFormat("#,##0.##", DecimalFormatSymbols.getInstance(Locale.ROOT))
            .format(stat.value());
    return stat.isPercentage() ? value + "%" : value + " " + stat.unit();
  }
}
