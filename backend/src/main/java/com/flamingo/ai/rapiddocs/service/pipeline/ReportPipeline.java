package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.api.dto.request.ReportGenerationRequest;
import com.flamingo.ai.rapiddocs.api.dto.request.StatisticRequest;
import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.model.ReportExtraction;
import com.flamingo.ai.rapiddocs.domain.model.Section;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import com.flamingo.ai.rapiddocs.service.content.ContentSegmenter;
import com.flamingo.ai.rapiddocs.service.extraction.PromptAnalysisService;
import com.flamingo.ai.rapiddocs.service.extraction.ReportExtractionMerger;
import com.flamingo.ai.rapiddocs.service.generation.TextGenerator;
import com.flamingo.ai.rapiddocs.service.illustration.IllustrationBatcher;
import com.flamingo.ai.rapiddocs.service.importer.ImportedRecord;
import com.flamingo.ai.rapiddocs.service.render.RenderRequest;
import com.flamingo.ai.rapiddocs.service.visualization.VisualizationDispatcher;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Illustrated report: prose sections, one chart per statistic and 2-4 illustrations. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportPipeline implements DocumentPipeline<ReportGenerationRequest, ReportDraft> {

  static final int MIN_IMAGES = 2;
  static final int MAX_IMAGES = 4;
  static final int DEFAULT_IMAGES = 3;
  static final int MIN_EXPLICIT_WORDS = 100;
  static final int MAX_EXPLICIT_WORDS = 10000;
  static final String DEFAULT_AUTHOR = "RapidDocs";

  private final PromptAnalysisService promptAnalysisService;
  private final TextGenerator textGenerator;
  private final ContentSegmenter contentSegmenter;
  private final VisualizationDispatcher visualizationDispatcher;
  private final IllustrationBatcher illustrationBatcher;
  private final ImportedDataLoader importedDataLoader;
  private final GenerationConfig generationConfig;

  @Override
  public DocumentType documentType() {
    return DocumentType.REPORT;
  }

  @Override
  public Class<ReportGenerationRequest> requestType() {
    return ReportGenerationRequest.class;
  }

  @Override
  public List<String> validate(ReportGenerationRequest request) {
    List<String> errors = new ArrayList<>();
    importedDataLoader.check(request.getImportFilePath()).ifPresent(errors::add);
    return errors;
  }

  @Override
  public ReportDraft analyze(ReportGenerationRequest request, GenerationJob job) {
    ReportExtraction extraction = promptAnalysisService.analyzeReport(request.getPrompt());
    ReportExtraction.ReportExtractionBuilder builder = extraction.toBuilder();

    if (RequestDefaults.hasText(request.getTitle())) {
      builder.title(request.getTitle().strip());
    }
    builder.statistics(
        combineStatistics(
            extraction.statistics(),
            request.getStatistics(),
            importedDataLoader.load(request.getImportFilePath())));

    if (request.getNumSections() != null) {
      builder.sectionCount(request.getNumSections());
      builder.sectionOutlines(
          fitOutlines(extraction.sectionOutlines(), request.getNumSections()));
    }
    if (request.getWordCount() != null) {
      builder.wordCount(
          Math.max(MIN_EXPLICIT_WORDS, Math.min(request.getWordCount(), MAX_EXPLICIT_WORDS)));
    }
    ReportExtraction resolved = builder.build();

    List<String> colors =
        RequestDefaults.colors(
            request.getColorScheme(),
            resolved.colorSuggestions(),
            generationConfig.getDefaultColors());
    return new ReportDraft(
        request.getPrompt(),
        resolved,
        colors,
        illustrationPrompts(resolved, request.getNumImages()),
        RequestDefaults.logo(request.getLogoPath(), job),
        request.getIncludeCoverPage() == null || request.getIncludeCoverPage(),
        RequestDefaults.textOr(request.getAuthor(), DEFAULT_AUTHOR));
  }

  @Override
  public List<Section> generateText(ReportDraft draft, GenerationJob job) {
    ReportExtraction extraction = draft.extraction();
    String raw;
    if (textGenerator.isActive()) {
      int maxTokens =
          Math.min(extraction.wordCount() * 2, generationConfig.getText().getMaxTokens());
      raw =
          textGenerator.generate(
              ReportContentPrompts.contentPrompt(draft.prompt(), extraction),
              maxTokens,
              generationConfig.getText().getTemperature());
    } else {
      log.info("Text generator inactive, using template body text");
      job.addWarning("Text generator inactive: report body uses template text");
      raw = ReportContentPrompts.templateText(extraction);
    }
    return contentSegmenter.segment(
        raw, extraction.sectionOutlines(), extraction.sectionCount());
  }

  @Override
  public List<Path> generateCharts(ReportDraft draft, GenerationJob job) {
    return visualizationDispatcher.renderAll(
        draft.extraction().statistics(), draft.colors(), job.chartDirectory());
  }

  @Override
  public List<Path> generateIllustrations(ReportDraft draft, GenerationJob job) {
    return illustrationBatcher.generate(draft.illustrationPrompts(), job.illustrationDirectory());
  }

  @Override
  public RenderRequest renderRequest(
      ReportDraft draft,
      List<Section> sections,
      List<Path> charts,
      List<Path> illustrations,
      GenerationJob job) {
    ReportExtraction extraction = draft.extraction();
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("Author", draft.author());
    metadata.put("Date", extraction.date());
    metadata.put("Topic", extraction.topic());
    return RenderRequest.builder()
        .title(extraction.title())
        .sections(sections)
        .chartPaths(charts)
        .illustrationPaths(illustrations)
        .outputPath(job.outputFile(extraction.title()))
        .logoPath(draft.logoPath())
        .includeCover(draft.includeCover())
        .metadata(metadata)
        .colors(draft.colors())
        .build();
  }

  /**
   * Appends explicit and imported statistics. When the extraction only holds the synthesized
   * defaults, the added statistics replace them.
   */
  static List<StatisticEntry> combineStatistics(
      List<StatisticEntry> extracted,
      List<StatisticRequest> explicit,
      List<ImportedRecord> imported) {
    List<StatisticEntry> added = new ArrayList<>();
    if (explicit != null) {
      explicit.forEach(stat -> added.add(stat.toEntry()));
    }
    imported.forEach(record -> added.add(record.toStatistic()));
    if (added.isEmpty()) {
      return extracted;
    }
    List<StatisticEntry> combined = new ArrayList<>();
    if (!extracted.equals(ReportExtractionMerger.DEFAULT_STATISTICS)) {
      combined.addAll(extracted);
    }
    combined.addAll(added);
    return combined;
  }

  /** Truncates or pads the outline to {@code count} entries, padding with "Section N". */
  static List<String> fitOutlines(List<String> outlines, int count) {
    List<String> fitted = new ArrayList<>(outlines.subList(0, Math.min(count, outlines.size())));
    while (fitted.size() < count) {
      fitted.add("Section " + (fitted.size() + 1));
    }
    return fitted;
  }

  static List<String> illustrationPrompts(ReportExtraction extraction, Integer requested) {
    int count =
        Math.max(MIN_IMAGES, Math.min(requested != null ? requested : DEFAULT_IMAGES, MAX_IMAGES));
    List<String> prompts = extraction.imagePrompts();
    List<String> selected = new ArrayList<>(prompts.subList(0, Math.min(count, prompts.size())));
    while (selected.size() < count) {
      selected.add(
          "Professional infographic illustration about "
              + extraction.topic()
              + ", clean modern design, suitable for business document");
    }
    return selected;
  }
}
