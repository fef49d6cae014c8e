package com.flamingo.ai.rapiddocs.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.rapiddocs.exception.LlmServiceException;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** {@link TextGenerator} backed by a LangChain4j {@link ChatModel}. */
@Service
@Slf4j
public class LangChain4jTextGenerator implements TextGenerator {

  private static final double STRUCTURED_TEMPERATURE = 0.3;

  private static final String JSON_INSTRUCTIONS =
      """

      IMPORTANT:
      - Return ONLY the JSON object, no markdown formatting
      - Do not wrap the JSON in code blocks
      - Use the data types described above

      Response (JSON only):
      """;

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final String modelName;

  public LangChain4jTextGenerator(
      ObjectProvider<ChatModel> chatModelProvider,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}") String modelName) {
    this.chatModel = chatModelProvider.getIfAvailable();
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.modelName = modelName;
    log.info("Text generator initialized: model={}, active={}", modelName, chatModel != null);
  }

  @Override
  public boolean isActive() {
    return chatModel != null;
  }

  @Override
  public String modelName() {
    return modelName;
  }

  @Override
  @CircuitBreaker(name = "openai")
  public String generate(String prompt, int maxTokens, double temperature) {
    ensureActive();
    log.debug("Text generation requested: {} chars, maxTokens={}", prompt.length(), maxTokens);
    ChatRequest request =
        ChatRequest.builder()
            .messages(UserMessage.from(prompt))
            .maxOutputTokens(maxTokens)
            .temperature(temperature)
            .build();
    String text = call(request, "text.generation");
    log.debug("Text generation returned {} chars", text.length());
    return text;
  }

  @Override
  @CircuitBreaker(name = "openai")
  public <T> T generateStructured(String prompt, Class<T> type, int maxTokens) {
    ensureActive();
    ChatRequest request =
        ChatRequest.builder()
            .messages(UserMessage.from(prompt + JSON_INSTRUCTIONS))
            .maxOutputTokens(maxTokens)
            .temperature(STRUCTURED_TEMPERATURE)
            .responseFormat(ResponseFormat.JSON)
            .build();
    String raw = call(request, "text.structured");
    String json = stripCodeFences(raw);
    try {
      T value = objectMapper.readValue(json, type);
      if (value == null) {
        throw new LlmServiceException("Structured response was empty");
      }
      return value;
    } catch (JsonProcessingException e) {
      meterRegistry.counter("text.structured.parse.failure").increment();
      throw new LlmServiceException(
          "Structured response could not be parsed as " + type.getSimpleName(), e);
    }
  }

  private String call(ChatRequest request, String metricName) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      ChatResponse response = chatModel.chat(request);
      String text = response.aiMessage() != null ? response.aiMessage().text() : null;
      if (text == null || text.isBlank()) {
        throw new LlmServiceException("Model returned an empty response");
      }
      meterRegistry.counter(metricName + ".success").increment();
      return text.trim();
    } catch (LlmServiceException e) {
      meterRegistry.counter(metricName + ".failure").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter(metricName + ".failure").increment();
      throw new LlmServiceException("Text generation call failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer(metricName + ".duration"));
    }
  }

  private void ensureActive() {
    if (chatModel == null) {
      throw new LlmServiceException("Text generator is inactive: no chat model configured");
    }
  }

  /** Removes a surrounding markdown code fence, if the model added one despite instructions. */
  static String stripCodeFences(String text) {
    String cleaned = text.trim();
    if (cleaned.startsWith("```json")) {
      cleaned = cleaned.substring(7);
    } else if (cleaned.startsWith("```")) {
      cleaned = cleaned.substring(3);
    }
    if (cleaned.endsWith("```")) {
      cleaned = cleaned.substring(0, cleaned.length() - 3);
    }
    return cleaned.trim();
  }
}
