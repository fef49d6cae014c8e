package com.flamingo.ai.rapiddocs.service.generation;

import com.flamingo.ai.rapiddocs.exception.LlmServiceException;
import dev.langchain4j.data.image.Image;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * {@link ImageGenerator} backed by a LangChain4j {@link ImageModel}.
 *
 * <p>The provider returns images in its own fixed sizes; the result is scaled to the requested
 * dimensions before it is written.
 */
@Service
@Slf4j
public class OpenAiImageGenerator implements ImageGenerator {

  static final int MIN_DIMENSION = 64;
  static final int MAX_DIMENSION = 2048;
  static final int MAX_PROMPT_LENGTH = 500;

  private static final String STYLE_SUFFIX =
      ", professional illustration, clean modern design, suitable for a business document";

  private final ImageModel imageModel;
  private final MeterRegistry meterRegistry;

  public OpenAiImageGenerator(
      ObjectProvider<ImageModel> imageModelProvider, MeterRegistry meterRegistry) {
    this.imageModel = imageModelProvider.getIfAvailable();
    this.meterRegistry = meterRegistry;
    log.info("Image generator initialized: active={}", imageModel != null);
  }

  @Override
  public boolean isActive() {
    return imageModel != null;
  }

  @Override
  @CircuitBreaker(name = "openai")
  public Path generateToFile(String prompt, Path outputPath, int width, int height)
      throws IOException {
    if (imageModel == null) {
      throw new LlmServiceException("Image generator is inactive: no image model configured");
    }
    int targetWidth = validateDimension(width);
    int targetHeight = validateDimension(height);
    String cleanedPrompt = enhancePrompt(prompt);

    log.debug("Generating image {}x{} for prompt: {}", targetWidth, targetHeight, cleanedPrompt);
    Image image;
    try {
      Response<Image> response = imageModel.generate(cleanedPrompt);
      image = response.content();
    } catch (RuntimeException e) {
      meterRegistry.counter("image.generation.failure").increment();
      throw new LlmServiceException("Image generation call failed: " + e.getMessage(), e);
    }

    BufferedImage decoded = decode(image);
    BufferedImage scaled = scale(decoded, targetWidth, targetHeight);

    Files.createDirectories(outputPath.toAbsolutePath().getParent());
    ImageIO.write(scaled, "png", outputPath.toFile());
    meterRegistry.counter("image.generation.success").increment();
    log.debug("Image saved: {}", outputPath);
    return outputPath;
  }

  /** Collapses whitespace, adds style hints and truncates to the provider's prompt limit. */
  static String enhancePrompt(String prompt) {
    String collapsed = String.join(" ", (prompt == null ? "" : prompt).trim().split("\\s+"));
    String enhanced = collapsed + STYLE_SUFFIX;
    if (enhanced.length() > MAX_PROMPT_LENGTH) {
      log.warn("Image prompt truncated to {} characters", MAX_PROMPT_LENGTH);
      enhanced = enhanced.substring(0, MAX_PROMPT_LENGTH);
    }
    return enhanced;
  }

  /** Clamps to [64, 2048] and rounds down to a multiple of 8. */
  static int validateDimension(int value) {
    int clamped = Math.max(MIN_DIMENSION, Math.min(value, MAX_DIMENSION));
    return (clamped / 8) * 8;
  }

  private BufferedImage decode(Image image) throws IOException {
    if (image == null) {
      throw new LlmServiceException("Image model returned no image");
    }
    BufferedImage decoded;
    if (image.base64Data() != null) {
      byte[] bytes = Base64.getDecoder().decode(image.base64Data());
      decoded = ImageIO.read(new ByteArrayInputStream(bytes));
    } else if (image.url() != null) {
      try (InputStream in = image.url().toURL().openStream()) {
        decoded = ImageIO.read(in);
      }
    } else {
      throw new LlmServiceException("Image model returned neither data nor URL");
    }
    if (decoded == null) {
      throw new LlmServiceException("Image model returned an unreadable image");
    }
    return decoded;
  }

  private static BufferedImage scale(BufferedImage source, int width, int height) {
    if (source.getWidth() == width && source.getHeight() == height) {
      return source;
    }
    BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = target.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.drawImage(source, 0, 0, width, height, null);
    } finally {
      g.dispose();
    }
    return target;
  }
}
