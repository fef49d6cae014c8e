package com.flamingo.ai.rapiddocs.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;
import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReportExtractionMergerTest {

  private final GenerationConfig config = new GenerationConfig();
  private final ReportExtractionMerger merger = new ReportExtractionMerger(config);

  @Test
  void shouldBeIdempotent_whenMergingWithItself() {
    ReportExtraction result =
        ReportExtraction.builder()
            .title("Solar Outlook")
            .topic("solar energy")
            .wordCount(800)
            .statistics(List.of(new StatisticEntry("Adoption", 45, "%", VisualizationType.GAUGE)))
            .build();

    ReportExtraction filled = merger.fillDefaults(result);

    assertThat(merger.merge(result, result)).isEqualTo(filled);
    assertThat(merger.merge(filled, filled)).isEqualTo(filled);
  }

  @Test
  void shouldDeriveSectionsAndPromptsFromLength() {
    ReportExtraction regex =
        ReportExtraction.builder().topic("urban cycling").wordCount(300).build();

    ReportExtraction merged = merger.merge(ReportExtraction.empty(), regex);

    assertThat(merged.wordCount()).isEqualTo(300);
    assertThat(merged.sectionCount()).isEqualTo(3);
    assertThat(merged.sectionOutlines())
        .hasSize(3)
        .first()
        .isEqualTo("Introduction to urban cycling");
    assertThat(merged.imagePrompts()).hasSize(3);
    assertThat(merged.title()).isEqualTo("urban cycling");
    assertThat(merged.tone()).isEqualTo("professional");
    assertThat(merged.date()).isNotBlank();
    assertThat(merged.colorSuggestions()).isEqualTo(config.getDefaultColors());
  }

  @Test
  void shouldClampWordAndSectionCounts() {
    ReportExtraction merged =
        merger.fillDefaults(ReportExtraction.builder().wordCount(10_000).sectionCount(20).build());

    assertThat(merged.wordCount()).isEqualTo(ReportExtractionMerger.MAX_WORD_COUNT);
    assertThat(merged.sectionCount()).isEqualTo(ReportExtractionMerger.MAX_SECTIONS);
  }

  @Test
  void shouldLetExplicitWordingBeatModelEstimate() {
    ReportExtraction ai = ReportExtraction.builder().wordCount(1200).sectionCount(4).build();
    ReportExtraction regex = ReportExtraction.builder().wordCount(300).build();

    ReportExtraction merged = merger.merge(ai, regex);

    assertThat(merged.wordCount()).isEqualTo(300);
    assertThat(merged.sectionCount()).isEqualTo(4);
  }

  @Test
  void shouldPreferRegexStatistics_whenAiOnlyHasPlaceholders() {
    ReportExtraction ai =
        ReportExtraction.builder()
            .statistics(List.of(new StatisticEntry("Statistic", 0, "units", null)))
            .build();
    ReportExtraction regex =
        ReportExtraction.builder()
            .statistics(List.of(new StatisticEntry("Approval", 72, "%", VisualizationType.GAUGE)))
            .build();

    assertThat(merger.merge(ai, regex).statistics())
        .extracting(StatisticEntry::name)
        .containsExactly("Approval");
  }

  @Test
  void shouldSynthesizeDefaultStatistics_whenNoneFound() {
    ReportExtraction merged = merger.merge(ReportExtraction.empty(), ReportExtraction.empty());

    assertThat(merged.statistics()).isEqualTo(ReportExtractionMerger.DEFAULT_STATISTICS);
    assertThat(merged.title()).isEqualTo("Professional Report");
    assertThat(merged.wordCount()).isEqualTo(500);
    assertThat(merged.sectionCount()).isEqualTo(3);
  }
}
