package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.api.dto.request.GenerationRequest;
import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.enums.GenerationStage;
import com.flamingo.ai.rapiddocs.domain.model.Section;
import com.flamingo.ai.rapiddocs.exception.CriticalStageException;
import com.flamingo.ai.rapiddocs.exception.GenerationValidationException;
import com.flamingo.ai.rapiddocs.service.render.DocumentRenderer;
import com.flamingo.ai.rapiddocs.service.render.RenderRequest;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs a generation job through its five stages.
 *
 * <p>ANALYZE, GENERATE_TEXT and RENDER are critical: any failure aborts the job with a {@link
 * CriticalStageException}. Charts and illustrations run side by side on the visual-stage executor
 * and degrade to an empty list on failure.
 */
@Service
@Slf4j
public class GenerationOrchestrator {

  static final String MDC_JOB_ID = "jobId";

  private final Map<DocumentType, DocumentPipeline<?, ?>> pipelines;
  private final DocumentRenderer documentRenderer;
  private final Validator validator;
  private final Executor visualStageExecutor;
  private final GenerationConfig generationConfig;
  private final MeterRegistry meterRegistry;

  public GenerationOrchestrator(
      List<DocumentPipeline<?, ?>> pipelines,
      DocumentRenderer documentRenderer,
      Validator validator,
      @Qualifier("visualStageExecutor") Executor visualStageExecutor,
      GenerationConfig generationConfig,
      MeterRegistry meterRegistry) {
    this.pipelines = new EnumMap<>(DocumentType.class);
    pipelines.forEach(pipeline -> this.pipelines.put(pipeline.documentType(), pipeline));
    this.documentRenderer = documentRenderer;
    this.validator = validator;
    this.visualStageExecutor = visualStageExecutor;
    this.generationConfig = generationConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Generates one document synchronously.
   *
   * @param request report or invoice request
   * @return the rendered document with per-stage status and warnings
   * @throws GenerationValidationException if the request is malformed; no stage has run
   * @throws CriticalStageException if a critical stage fails
   */
  @Timed(value = "generation.execute", description = "Time to generate one document")
  public GenerationResult execute(GenerationRequest request) {
    if (request == null) {
      throw new GenerationValidationException(List.of("request: must not be null"));
    }
    DocumentPipeline<?, ?> pipeline = pipelines.get(request.getDocumentType());
    if (pipeline == null) {
      throw new GenerationValidationException(
          List.of("documentType: unsupported document type " + request.getDocumentType()));
    }
    return run(pipeline, request);
  }

  private <R extends GenerationRequest, D> GenerationResult run(
      DocumentPipeline<R, D> pipeline, GenerationRequest rawRequest) {
    R request = pipeline.requestType().cast(rawRequest);
    validate(pipeline, request);

    GenerationJob job =
        GenerationJob.start(pipeline.documentType(), Path.of(generationConfig.getOutputDir()));
    MDC.put(MDC_JOB_ID, job.getJobId());
    try {
      log.info("Starting {} generation job {}", pipeline.documentType(), job.getJobId());

      D draft = runCritical(job, GenerationStage.ANALYZE, () -> pipeline.analyze(request, job));
      List<Section> sections =
          runCritical(job, GenerationStage.GENERATE_TEXT, () -> pipeline.generateText(draft, job));

      CompletableFuture<List<Path>> chartsFuture =
          fanOut(
              () ->
                  runBestEffort(
                      job,
                      GenerationStage.GENERATE_CHARTS,
                      () -> pipeline.generateCharts(draft, job)));
      CompletableFuture<List<Path>> illustrationsFuture =
          fanOut(
              () ->
                  runBestEffort(
                      job,
                      GenerationStage.GENERATE_ILLUSTRATIONS,
                      () -> pipeline.generateIllustrations(draft, job)));
      List<Path> charts = chartsFuture.join();
      List<Path> illustrations = illustrationsFuture.join();

      RenderRequest renderRequest =
          pipeline.renderRequest(draft, sections, charts, illustrations, job);
      Path output =
          runCritical(job, GenerationStage.RENDER, () -> documentRenderer.render(renderRequest));

      meterRegistry
          .counter("generation.jobs.success", "type", pipeline.documentType().name())
          .increment();
      List<String> warnings = job.getWarnings();
      log.info(
          "Job {} completed: output={}, sections={}, charts={}, illustrations={}, warnings={}",
          job.getJobId(),
          output.getFileName(),
          sections.size(),
          charts.size(),
          illustrations.size(),
          warnings.size());
      return GenerationResult.builder()
          .jobId(job.getJobId())
          .documentType(pipeline.documentType())
          .title(renderRequest.title())
          .outputPath(output)
          .sectionCount(sections.size())
          .chartCount(charts.size())
          .illustrationCount(illustrations.size())
          .stages(job.getStages())
          .warnings(warnings)
          .build();
    } catch (CriticalStageException e) {
      meterRegistry
          .counter("generation.jobs.failure", "type", pipeline.documentType().name())
          .increment();
      throw e;
    } finally {
      MDC.remove(MDC_JOB_ID);
    }
  }

  private <R extends GenerationRequest> void validate(DocumentPipeline<R, ?> pipeline, R request) {
    List<String> errors = new ArrayList<>();
    for (ConstraintViolation<R> violation : validator.validate(request)) {
      errors.add(violation.getPropertyPath() + ": " + violation.getMessage());
    }
    errors.sort(String::compareTo);
    if (errors.isEmpty()) {
      errors.addAll(pipeline.validate(request));
    }
    if (!errors.isEmpty()) {
      log.warn("Rejected {} request: {}", pipeline.documentType(), errors);
      throw new GenerationValidationException(errors);
    }
  }

  private <T> T runCritical(GenerationJob job, GenerationStage stage, StageAction<T> action) {
    job.markRunning(stage);
    log.info("Stage {} started", stage);
    try {
      T result = action.run();
      job.markCompleted(stage);
      log.info("Stage {} completed", stage);
      return result;
    } catch (Exception e) {
      job.markFailed(stage);
      log.error("Critical stage {} failed for job {}", stage, job.getJobId(), e);
      throw new CriticalStageException(stage, job.getJobId(), e);
    }
  }

  private List<Path> runBestEffort(
      GenerationJob job, GenerationStage stage, StageAction<List<Path>> action) {
    job.markRunning(stage);
    log.info("Stage {} started", stage);
    try {
      List<Path> result = action.run();
      job.markCompleted(stage);
      log.info("Stage {} completed with {} artifacts", stage, result.size());
      return result;
    } catch (Exception e) {
      log.warn("Stage {} degraded, continuing without its artifacts: {}", stage, e.getMessage());
      job.markDegraded(stage, String.valueOf(e.getMessage()));
      meterRegistry.counter("generation.stage.degraded", "stage", stage.name()).increment();
      return List.of();
    }
  }

  /** Submits to the visual-stage executor with the caller's MDC, or runs inline if rejected. */
  private CompletableFuture<List<Path>> fanOut(Supplier<List<Path>> task) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    Supplier<List<Path>> withContext =
        () -> {
          Map<String, String> previous = MDC.getCopyOfContextMap();
          if (context != null) {
            MDC.setContextMap(context);
          }
          try {
            return task.get();
          } finally {
            if (previous != null) {
              MDC.setContextMap(previous);
            } else {
              MDC.clear();
            }
          }
        };
    try {
      return CompletableFuture.supplyAsync(withContext, visualStageExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Visual stage executor saturated, running stage inline");
      return CompletableFuture.completedFuture(task.get());
    }
  }

  @FunctionalInterface
  interface StageAction<T> {
    T run() throws Exception;
  }
}
