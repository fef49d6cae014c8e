package com.flamingo.ai.rapiddocs.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.rapiddocs.exception.LlmServiceException;
import dev.langchain4j.data.image.Image;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Base64;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class OpenAiImageGeneratorTest {

  @Mock private ObjectProvider<ImageModel> imageModelProvider;
  @Mock private ImageModel imageModel;

  @TempDir Path dir;

  @Test
  void shouldCollapseWhitespaceAndCapPromptLength() {
    assertThat(OpenAiImageGenerator.enhancePrompt("  a   wind\n farm "))
        .startsWith("a wind farm, professional illustration");
    assertThat(OpenAiImageGenerator.enhancePrompt("word ".repeat(200)))
        .hasSize(OpenAiImageGenerator.MAX_PROMPT_LENGTH);
  }

  @Test
  void shouldClampDimensionsToMultiplesOfEight() {
    assertThat(OpenAiImageGenerator.validateDimension(10)).isEqualTo(64);
    assertThat(OpenAiImageGenerator.validateDimension(5000)).isEqualTo(2048);
    assertThat(OpenAiImageGenerator.validateDimension(770)).isEqualTo(768);
  }

  @Test
  void shouldReportInactiveAndRefuse_whenNoModel() {
    when(imageModelProvider.getIfAvailable()).thenReturn(null);
    OpenAiImageGenerator generator =
        new OpenAiImageGenerator(imageModelProvider, new SimpleMeterRegistry());

    assertThat(generator.isActive()).isFalse();
    assertThatThrownBy(() -> generator.generateToFile("x", dir.resolve("a.png"), 64, 64))
        .isInstanceOf(LlmServiceException.class);
  }

  @Test
  void shouldDecodeAndScaleBase64Image() throws IOException {
    // Given
    when(imageModelProvider.getIfAvailable()).thenReturn(imageModel);
    Image image = Image.builder().base64Data(pngBase64(100, 50)).build();
    when(imageModel.generate(anyString())).thenReturn(Response.from(image));
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    OpenAiImageGenerator generator = new OpenAiImageGenerator(imageModelProvider, registry);

    // When
    Path out = generator.generateToFile("harbour", dir.resolve("nested/out.png"), 130, 70);

    // Then
    BufferedImage written = ImageIO.read(out.toFile());
    assertThat(written.getWidth()).isEqualTo(128);
    assertThat(written.getHeight()).isEqualTo(64);
    assertThat(registry.counter("image.generation.success").count()).isEqualTo(1.0);
  }

  @Test
  void shouldWrapProviderFailure() {
    when(imageModelProvider.getIfAvailable()).thenReturn(imageModel);
    when(imageModel.generate(anyString())).thenThrow(new IllegalStateException("429"));
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    OpenAiImageGenerator generator = new OpenAiImageGenerator(imageModelProvider, registry);

    assertThatThrownBy(() -> generator.generateToFile("x", dir.resolve("a.png"), 64, 64))
        .isInstanceOf(LlmServiceException.class)
        .hasMessageContaining("429");
    assertThat(registry.counter("image.generation.failure").count()).isEqualTo(1.0);
  }

  private static String pngBase64(int width, int height) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", bytes);
    return Base64.getEncoder().encodeToString(bytes.toByteArray());
  }
}
