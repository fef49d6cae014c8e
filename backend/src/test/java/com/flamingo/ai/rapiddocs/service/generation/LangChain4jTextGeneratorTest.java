package com.flamingo.ai.rapiddocs.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.rapiddocs.exception.LlmServiceException;
import com.flamingo.ai.rapiddocs.service.extraction.dto.ReportExtractionPayload;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class LangChain4jTextGeneratorTest {

  @Mock private ObjectProvider<ChatModel> chatModelProvider;
  @Mock private ChatModel chatModel;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  private LangChain4jTextGenerator generator(ChatModel model) {
    when(chatModelProvider.getIfAvailable()).thenReturn(model);
    return new LangChain4jTextGenerator(
        chatModelProvider, new ObjectMapper(), meterRegistry, "gpt-4o-mini");
  }

  private static ChatResponse reply(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  @Test
  void shouldStripMarkdownFences() {
    assertThat(LangChain4jTextGenerator.stripCodeFences("```json\n{\"a\":1}\n```"))
        .isEqualTo("{\"a\":1}");
    assertThat(LangChain4jTextGenerator.stripCodeFences("```\n{}\n```")).isEqualTo("{}");
    assertThat(LangChain4jTextGenerator.stripCodeFences(" {} ")).isEqualTo("{}");
  }

  @Test
  void shouldBindSnakeCaseJson() {
    LangChain4jTextGenerator generator = generator(chatModel);
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(
            reply(
                "```json\n{\"title\":\"EV Report\",\"num_sections\":4,"
                    + "\"statistics\":[{\"name\":\"Share\",\"value\":18,"
                    + "\"visualization_type\":\"pie_chart\"}],\"extra\":true}\n```"));

    ReportExtractionPayload payload =
        generator.generateStructured("prompt", ReportExtractionPayload.class, 500);

    assertThat(payload.title()).isEqualTo("EV Report");
    assertThat(payload.numSections()).isEqualTo(4);
    assertThat(payload.statistics().get(0).visualizationType()).isEqualTo("pie_chart");
  }

  @Test
  void shouldFailOnInvalidJson() {
    LangChain4jTextGenerator generator = generator(chatModel);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("not json at all"));

    assertThatThrownBy(
            () -> generator.generateStructured("prompt", ReportExtractionPayload.class, 500))
        .isInstanceOf(LlmServiceException.class);
    assertThat(meterRegistry.counter("text.structured.parse.failure").count()).isEqualTo(1.0);
  }

  @Test
  void shouldRejectEmptyAnswer() {
    LangChain4jTextGenerator generator = generator(chatModel);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("   "));

    assertThatThrownBy(() -> generator.generate("prompt", 100, 0.7))
        .isInstanceOf(LlmServiceException.class);
    assertThat(meterRegistry.counter("text.generation.failure").count()).isEqualTo(1.0);
  }

  @Test
  void shouldBeInactiveWithoutModel() {
    LangChain4jTextGenerator generator = generator(null);

    assertThat(generator.isActive()).isFalse();
    assertThatThrownBy(() -> generator.generate("prompt", 100, 0.7))
        .isInstanceOf(LlmServiceException.class);
  }
}
