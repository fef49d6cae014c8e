package com.flamingo.ai.rapiddocs.service.extraction;

import static com.flamingo.ai.rapiddocs.service.extraction.PlaceholderSentinels.orDefault;
import static com.flamingo.ai.rapiddocs.service.extraction.PlaceholderSentinels.pickBest;

import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;
import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Merges report extractions and derives everything the prompt left open: length, section count,
 * outlines, illustration prompts, colours, tone and date.
 */
@Component
@RequiredArgsConstructor
public class ReportExtractionMerger implements ExtractionMerger<ReportExtraction> {

  public static final int MIN_WORD_COUNT = 200;
  public static final int MAX_WORD_COUNT = 5000;
  public static final int MIN_SECTIONS = 2;
  public static final int MAX_SECTIONS = 8;

  static final int DEFAULT_WORD_COUNT = 500;
  static final String DEFAULT_TONE = "professional";
  static final String DEFAULT_TOPIC = "the topic";
  static final String DEFAULT_TITLE = "Professional Report";

  public static final List<StatisticEntry> DEFAULT_STATISTICS =
      List.of(
          new StatisticEntry("Overall Progress", 75, "%", VisualizationType.GAUGE),
          new StatisticEntry("Year-over-Year Growth", 12, "%", VisualizationType.BAR));

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

  private final GenerationConfig generationConfig;

  @Override
  public ReportExtraction merge(ReportExtraction ai, ReportExtraction regex) {
    ReportExtraction merged =
        ReportExtraction.builder()
            .title(pickBest(ai.title(), regex.title(), PlaceholderSentinels.EMPTY))
            .topic(pickBest(ai.topic(), regex.topic(), PlaceholderSentinels.EMPTY))
            .tone(pickBest(ai.tone(), regex.tone(), PlaceholderSentinels.EMPTY))
            .date(pickBest(ai.date(), regex.date(), PlaceholderSentinels.EMPTY))
            // explicit wording in the prompt beats the model's estimate
            .wordCount(regex.wordCount() > 0 ? regex.wordCount() : ai.wordCount())
            .sectionCount(ai.sectionCount() > 0 ? ai.sectionCount() : regex.sectionCount())
            .statistics(
                hasRealStatistics(ai.statistics()) ? ai.statistics() : regex.statistics())
            .imagePrompts(ai.imagePrompts().isEmpty() ? regex.imagePrompts() : ai.imagePrompts())
            .sectionOutlines(
                ai.sectionOutlines().isEmpty() ? regex.sectionOutlines() : ai.sectionOutlines())
            .colorSuggestions(
                ai.colorSuggestions().isEmpty()
                    ? regex.colorSuggestions()
                    : ai.colorSuggestions())
            .build();
    return fillDefaults(merged);
  }

  @Override
  public ReportExtraction fillDefaults(ReportExtraction result) {
    int wordCount =
        clamp(
            result.wordCount() > 0 ? result.wordCount() : DEFAULT_WORD_COUNT,
            MIN_WORD_COUNT,
            MAX_WORD_COUNT);
    int sectionCount =
        clamp(
            result.sectionCount() > 0 ? result.sectionCount() : sectionsFor(wordCount),
            MIN_SECTIONS,
            MAX_SECTIONS);

    String topic = orDefault(result.topic(), orDefault(result.title(), DEFAULT_TOPIC));
    String title = orDefault(result.title(), topic.equals(DEFAULT_TOPIC) ? DEFAULT_TITLE : topic);

    return result.toBuilder()
        .title(title)
        .topic(topic)
        .tone(orDefault(result.tone(), DEFAULT_TONE))
        .date(orDefault(result.date(), LocalDate.now().format(DATE_FORMAT)))
        .wordCount(wordCount)
        .sectionCount(sectionCount)
        .statistics(result.statistics().isEmpty() ? DEFAULT_STATISTICS : result.statistics())
        .imagePrompts(
            result.imagePrompts().isEmpty()
                ? defaultImagePrompts(topic, sectionCount)
                : result.imagePrompts())
        .sectionOutlines(
            result.sectionOutlines().isEmpty()
                ? defaultSectionOutlines(topic, sectionCount)
                : result.sectionOutlines())
        .colorSuggestions(
            result.colorSuggestions().isEmpty()
                ? List.copyOf(generationConfig.getDefaultColors())
                : result.colorSuggestions())
        .build();
  }

  /** 3 sections by default, 4 above 500 words, 5 above 1000. */
  static int sectionsFor(int wordCount) {
    if (wordCount > 1000) {
      return 5;
    }
    return wordCount > 500 ? 4 : 3;
  }

  static List<String> defaultImagePrompts(String topic, int sectionCount) {
    List<String> prompts =
        List.of(
            "Professional infographic illustration showing "
                + topic
                + ", modern clean design, business style",
            "Abstract visualization representing " + topic + ", geometric shapes, corporate colors",
            "Conceptual illustration of " + topic + ", minimalist style, professional aesthetic",
            "Data-driven visual representation of "
                + topic
                + ", charts and icons, modern design");
    return prompts.subList(0, Math.min(sectionCount, prompts.size()));
  }

  static List<String> defaultSectionOutlines(String topic, int sectionCount) {
    List<String> outlines =
        List.of(
            "Introduction to " + topic,
            "Key Aspects and Analysis",
            "Current Trends and Data",
            "Implications and Impact",
            "Future Outlook",
            "Conclusions and Recommendations");
    return outlines.subList(0, Math.min(sectionCount, outlines.size()));
  }

  private static boolean hasRealStatistics(List<StatisticEntry> statistics) {
    return !statistics.isEmpty()
        && !statistics.stream()
            .allMatch(stat -> PlaceholderSentinels.STATISTIC_NAMES.contains(stat.name()));
  }

  private static int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(value, max));
  }
}
