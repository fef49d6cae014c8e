package com.flamingo.ai.rapiddocs.service.illustration;

import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.service.generation.ImageGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates illustrations in fixed-size concurrent batches, pausing between batches to stay under
 * provider rate limits.
 *
 * <p>Every prompt yields a file: a failed or skipped generation is replaced by a placeholder, so
 * the result always has one path per prompt, in prompt order.
 */
@Service
@Slf4j
public class IllustrationBatcher {

  private final ImageGenerator imageGenerator;
  private final PlaceholderImageFactory placeholderFactory;
  private final GenerationConfig generationConfig;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public IllustrationBatcher(
      ImageGenerator imageGenerator,
      PlaceholderImageFactory placeholderFactory,
      GenerationConfig generationConfig,
      @Qualifier("illustrationExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.imageGenerator = imageGenerator;
    this.placeholderFactory = placeholderFactory;
    this.generationConfig = generationConfig;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Generates one image per prompt into {@code directory} as {@code illustration_{n}.png}.
   *
   * @return one path per prompt, in order
   * @throws UncheckedIOException if a placeholder cannot be written either
   */
  public List<Path> generate(List<String> prompts, Path directory) {
    GenerationConfig.Illustrations settings = generationConfig.getIllustrations();
    int batchSize = Math.max(1, settings.getBatchSize());
    boolean active = imageGenerator.isActive();
    if (!active) {
      log.info("Image generator inactive, using placeholders for {} illustrations", prompts.size());
    }

    List<Path> results = new ArrayList<>(prompts.size());
    for (int start = 0; start < prompts.size(); start += batchSize) {
      if (start > 0) {
        pause(settings.getBatchPauseMs());
      }
      int end = Math.min(start + batchSize, prompts.size());
      List<CompletableFuture<Path>> batch = new ArrayList<>(end - start);
      for (int i = start; i < end; i++) {
        String prompt = prompts.get(i);
        Path target = directory.resolve("illustration_" + (i + 1) + ".png");
        batch.add(
            CompletableFuture.supplyAsync(
                () -> generateOne(prompt, target, active, settings), executor));
      }
      log.debug("Illustration batch {}-{} submitted", start + 1, end);
      results.addAll(awaitAll(batch));
    }
    return results;
  }

  private Path generateOne(
      String prompt, Path target, boolean active, GenerationConfig.Illustrations settings) {
    if (active) {
      try {
        return imageGenerator.generateToFile(
            prompt, target, settings.getWidth(), settings.getHeight());
      } catch (Exception e) {
        log.warn(
            "Illustration {} failed, using placeholder: {}", target.getFileName(), e.getMessage());
      }
    }
    try {
      meterRegistry.counter("generation.illustrations.placeholder").increment();
      return placeholderFactory.create(prompt, target, settings.getWidth(), settings.getHeight());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write placeholder " + target, e);
    }
  }

  private static List<Path> awaitAll(List<CompletableFuture<Path>> batch) {
    List<Path> paths = new ArrayList<>(batch.size());
    try {
      for (CompletableFuture<Path> future : batch) {
        paths.add(future.join());
      }
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
    return paths;
  }

  private static void pause(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted during pause between illustration batches");
    }
  }
}
