package com.flamingo.ai.rapiddocs.service.generation;

import java.io.IOException;
import java.nio.file.Path;

/** Illustration provider. */
public interface ImageGenerator {

  /** Whether a model is configured and calls can be made. */
  boolean isActive();

  /**
   * Generates an image for {@code prompt} and writes it as PNG.
   *
   * @param prompt description of the image
   * @param outputPath file to write; parent directories are created
   * @param width requested width in pixels
   * @param height requested height in pixels
   * @return {@code outputPath}
   * @throws IOException if the image cannot be written
   * @throws com.flamingo.ai.rapiddocs.exception.LlmServiceException if the provider fails
   */
  Path generateToFile(String prompt, Path outputPath, int width, int height) throws IOException;
}
