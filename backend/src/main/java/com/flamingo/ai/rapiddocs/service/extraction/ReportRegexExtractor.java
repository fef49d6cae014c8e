package com.flamingo.ai.rapiddocs.service.extraction;

import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;
import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts report title, topic, target length and inline statistics from a prompt.
 *
 * <p>Section count, outlines, image prompts, tone, date and colours are left empty here; the
 * default-fill pass of {@link ReportExtractionMerger} derives them.
 */
@Component
@Slf4j
public class ReportRegexExtractor implements RegexExtractor<ReportExtraction> {

  static final int BRIEF_WORD_COUNT = 300;
  static final int DETAILED_WORD_COUNT = 1500;

  private static final int MAX_TITLE_LENGTH = 100;
  private static final int MAX_TOPIC_LENGTH = 200;
  private static final int MAX_STAT_NAME_LENGTH = 50;

  private static final Pattern WORD_COUNT = Pattern.compile("(\\d+)\\s*words?");
  private static final Pattern TITLE_KEYWORD =
      Pattern.compile(
          "\\b(?:titled?|about|regarding|on)\\s+[\"']?([^\"'.]+)[\"']?", Pattern.CASE_INSENSITIVE);
  private static final Pattern TITLE_LEADING_PHRASE =
      Pattern.compile("^([A-Z][^.]{10,50})", Pattern.CASE_INSENSITIVE);

  private static final Pattern PERCENT =
      Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*%\\s*(?:of\\s+)?([^,.]+)");
  private static final Pattern CURRENCY =
      Pattern.compile("\\$\\s*(\\d+(?:,\\d{3})*(?:\\.\\d{2})?)\\s*(?:for|in|of)?\\s*([^,.]+)?");
  private static final Pattern COUNTED_NOUN =
      Pattern.compile(
          "(\\d+(?:,\\d{3})*)\\s+(users?|customers?|items?|products?|employees?|sales?|orders?)",
          Pattern.CASE_INSENSITIVE);

  @Override
  public ReportExtraction extract(String prompt) {
    String text = prompt == null ? "" : prompt.trim();
    ReportExtraction result =
        ReportExtraction.builder()
            .title(extractTitle(text))
            .topic(extractTopic(text))
            .wordCount(extractWordCount(text))
            .statistics(extractStatistics(text))
            .build();
    log.debug(
        "Regex extracted: title='{}', wordCount={}, statistics={}",
        result.title(),
        result.wordCount(),
        result.statistics().size());
    return result;
  }

  /** Explicit {@code N words}, else a length adjective, else 0 (unknown). */
  static int extractWordCount(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    Matcher matcher = WORD_COUNT.matcher(lower);
    if (matcher.find()) {
      try {
        return Integer.parseInt(matcher.group(1));
      } catch (NumberFormatException e) {
        return Integer.MAX_VALUE;
      }
    }
    if (lower.contains("brief") || lower.contains("short")) {
      return BRIEF_WORD_COUNT;
    }
    if (lower.contains("detailed") || lower.contains("comprehensive")) {
      return DETAILED_WORD_COUNT;
    }
    return 0;
  }

  static String extractTitle(String text) {
    if (text.isEmpty()) {
      return "";
    }
    for (Pattern pattern : List.of(TITLE_KEYWORD, TITLE_LEADING_PHRASE)) {
      Matcher matcher = pattern.matcher(text);
      if (matcher.find()) {
        return truncate(matcher.group(1).trim(), MAX_TITLE_LENGTH);
      }
    }
    return Arrays.stream(text.split("\\s+"))
        .limit(8)
        .map(ReportRegexExtractor::capitalize)
        .collect(Collectors.joining(" "));
  }

  /** First sentence, capped at 200 characters. */
  static String extractTopic(String text) {
    int period = text.indexOf('.');
    String sentence = period >= 0 ? text.substring(0, period) : text;
    return truncate(sentence, MAX_TOPIC_LENGTH).trim();
  }

  static List<StatisticEntry> extractStatistics(String text) {
    List<StatisticEntry> statistics = new ArrayList<>();

    Matcher percent = PERCENT.matcher(text);
    while (percent.find()) {
      String name = statName(percent.group(2));
      if (name.isEmpty()) {
        continue;
      }
      double value = Double.parseDouble(percent.group(1));
      VisualizationType type = value <= 100 ? VisualizationType.GAUGE : VisualizationType.BAR;
      statistics.add(new StatisticEntry(name, value, "%", type));
    }

    Matcher currency = CURRENCY.matcher(text);
    while (currency.find()) {
      double value = Double.parseDouble(currency.group(1).replace(",", ""));
      String name = currency.group(2) != null ? statName(currency.group(2)) : "";
      statistics.add(
          new StatisticEntry(
              name.isEmpty() ? "Revenue" : name, value, "USD", VisualizationType.BAR));
    }

    Matcher counted = COUNTED_NOUN.matcher(text);
    while (counted.find()) {
      double value = Double.parseDouble(counted.group(1).replace(",", ""));
      String unit = counted.group(2).toLowerCase(Locale.ROOT);
      statistics.add(new StatisticEntry(capitalize(unit), value, unit, VisualizationType.NUMBER));
    }
    return statistics;
  }

  private static String statName(String raw) {
    return truncate(raw.trim(), MAX_STAT_NAME_LENGTH).trim();
  }

  private static String capitalize(String word) {
    if (word.isEmpty()) {
      return word;
    }
    return Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase(Locale.ROOT);
  }

  private static String truncate(String value, int max) {
    return value.length() <= max ? value : value.substring(0, max);
  }
}
