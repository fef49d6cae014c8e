package com.flamingo.ai.rapiddocs.service.content;

import com.flamingo.ai.rapiddocs.domain.model.Section;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits generated prose into a fixed number of document sections.
 *
 * <p>Text written as numbered sections ({@code "1. Heading\nbody"}) is split at the numbers.
 * Anything else is cut into contiguous word chunks of near-equal size, headed by the outline.
 */
@Component
@Slf4j
public class ContentSegmenter {

  private static final Pattern SECTION_BOUNDARY = Pattern.compile("\\n(?=\\d+\\.\\s+[A-Z])");
  private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+\\.\\s*");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Segments {@code rawText} into exactly {@code sectionCount} sections.
   *
   * @param rawText generated text, may be null or empty
   * @param outline preferred headings, used where the text has none; may be shorter than the count
   * @param sectionCount number of sections to produce
   * @return exactly {@code sectionCount} sections
   * @throws IllegalArgumentException if {@code sectionCount} is less than 1
   */
  public List<Section> segment(String rawText, List<String> outline, int sectionCount) {
    if (sectionCount < 1) {
      throw new IllegalArgumentException("sectionCount must be at least 1, was " + sectionCount);
    }
    String text = rawText == null ? "" : rawText.strip();
    List<String> headings = outline == null ? List.of() : outline;

    String[] parts = SECTION_BOUNDARY.split(text);
    if (parts.length >= sectionCount) {
      log.debug(
          "Splitting at numbered headings: {} parts, {} sections",
          parts.length,
          sectionCount);
      return splitAtHeadings(parts, headings, sectionCount);
    }
    log.debug(
        "Text has {} numbered parts for {} sections, splitting by word count",
        parts.length,
        sectionCount);
    return splitByWords(text, headings, sectionCount);
  }

  private static List<Section> splitAtHeadings(
      String[] parts, List<String> outline, int sectionCount) {
    List<Section> sections = new ArrayList<>(sectionCount);
    for (int i = 0; i < sectionCount; i++) {
      String part = parts[i];
      String[] lines = part.strip().split("\n", 2);
      String heading = LEADING_NUMBER.matcher(lines[0].strip()).replaceFirst("");
      String body = lines.length > 1 ? lines[1].strip() : part;
      sections.add(new Section(heading.isEmpty() ? headingFor(outline, i) : heading, body));
    }
    return sections;
  }

  private static List<Section> splitByWords(String text, List<String> outline, int sectionCount) {
    String[] words = text.isEmpty() ? new String[0] : WHITESPACE.split(text);
    int base = words.length / sectionCount;
    int extra = words.length % sectionCount;

    List<Section> sections = new ArrayList<>(sectionCount);
    int start = 0;
    for (int i = 0; i < sectionCount; i++) {
      int size = base + (i < extra ? 1 : 0);
      String body = String.join(" ", Arrays.copyOfRange(words, start, start + size));
      sections.add(new Section(headingFor(outline, i), body));
      start += size;
    }
    return sections;
  }

  private static String headingFor(List<String> outline, int index) {
    if (index < outline.size() && outline.get(index) != null && !outline.get(index).isBlank()) {
      return outline.get(index);
    }
    return "Section " + (index + 1);
  }
}
