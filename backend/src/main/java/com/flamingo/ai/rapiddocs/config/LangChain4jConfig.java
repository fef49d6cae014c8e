package com.flamingo.ai.rapiddocs.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiImageModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>Models are only created when an API key is configured. Without one the generators report
 * themselves inactive and the pipeline runs in its degraded (regex / template / placeholder) mode.
 */
@Configuration
@ConditionalOnExpression("!'${langchain4j.openai.api-key:}'.isBlank()")
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:4096}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:120}")
  private long chatTimeoutSeconds;

  @Value("${langchain4j.openai.image-model.model-name:dall-e-3}")
  private String imageModelName;

  @Value("${langchain4j.openai.image-model.size:1792x1024}")
  private String imageSize;

  @Value("${langchain4j.openai.image-model.timeout-seconds:90}")
  private long imageTimeoutSeconds;

  @Bean
  public ChatModel chatModel() {
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(chatTimeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public ImageModel imageModel() {
    return OpenAiImageModel.builder()
        .apiKey(openAiApiKey)
        .modelName(imageModelName)
        .size(imageSize)
        .responseFormat("b64_json")
        .timeout(Duration.ofSeconds(imageTimeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
