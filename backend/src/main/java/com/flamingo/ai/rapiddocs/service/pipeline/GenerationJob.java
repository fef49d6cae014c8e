package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.enums.GenerationStage;
import com.flamingo.ai.rapiddocs.domain.enums.StageStatus;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;

/**
 * In-memory state of one generation run: correlation id, per-stage status and collected warnings.
 *
 * <p>Created per call and never shared between jobs. The chart and illustration stages update it
 * from different threads, so mutators are synchronized.
 */
@Getter
public class GenerationJob {

  private static final int MAX_TITLE_IN_FILE_NAME = 50;

  private final String jobId;
  private final DocumentType documentType;
  private final Path outputRoot;
  private final Map<GenerationStage, StageStatus> stages = new EnumMap<>(GenerationStage.class);
  private final List<String> warnings = new ArrayList<>();

  public GenerationJob(String jobId, DocumentType documentType, Path outputRoot) {
    this.jobId = jobId;
    this.documentType = documentType;
    this.outputRoot = outputRoot;
    for (GenerationStage stage : GenerationStage.values()) {
      stages.put(stage, StageStatus.PENDING);
    }
  }

  /** Starts a job with a fresh 8-character id. */
  public static GenerationJob start(DocumentType documentType, Path outputRoot) {
    String jobId = UUID.randomUUID().toString().substring(0, 8);
    return new GenerationJob(jobId, documentType, outputRoot);
  }

  public synchronized void markRunning(GenerationStage stage) {
    stages.put(stage, StageStatus.RUNNING);
  }

  /** Marks the stage completed unless it was already marked degraded while running. */
  public synchronized void markCompleted(GenerationStage stage) {
    if (stages.get(stage) != StageStatus.DEGRADED) {
      stages.put(stage, StageStatus.COMPLETED);
    }
  }

  public synchronized void markDegraded(GenerationStage stage, String warning) {
    stages.put(stage, StageStatus.DEGRADED);
    warnings.add(stage + ": " + warning);
  }

  /** Records a warning that does not affect any stage status. */
  public synchronized void addWarning(String warning) {
    warnings.add(warning);
  }

  public synchronized void markFailed(GenerationStage stage) {
    stages.put(stage, StageStatus.FAILED);
  }

  public synchronized StageStatus getStatus(GenerationStage stage) {
    return stages.get(stage);
  }

  public synchronized Map<GenerationStage, StageStatus> getStages() {
    return Collections.unmodifiableMap(new EnumMap<>(stages));
  }

  public synchronized List<String> getWarnings() {
    return List.copyOf(warnings);
  }

  public Path chartDirectory() {
    return outputRoot.resolve("charts_" + jobId);
  }

  public Path illustrationDirectory() {
    return outputRoot.resolve("illustrations_" + jobId);
  }

  /** {@code {type}_{jobId}_{title}.pdf} with the title reduced to safe characters. */
  public Path outputFile(String title) {
    return outputRoot.resolve(
        documentType.getFilePrefix() + "_" + jobId + "_" + safeFileTitle(title) + ".pdf");
  }

  static String safeFileTitle(String title) {
    String source = title == null ? "" : title.strip();
    StringBuilder safe = new StringBuilder();
    for (int i = 0; i < source.length() && safe.length() < MAX_TITLE_IN_FILE_NAME; i++) {
      char ch = source.charAt(i);
      safe.append(Character.isLetterOrDigit(ch) && ch < 128 || ch == '-' ? ch : '_');
    }
    return safe.length() == 0 ? "document" : safe.toString();
  }
}
