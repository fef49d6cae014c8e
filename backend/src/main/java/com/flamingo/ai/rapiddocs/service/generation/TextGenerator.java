package com.flamingo.ai.rapiddocs.service.generation;

/**
 * Text generation provider used for structured extraction and document prose.
 *
 * <p>An inactive generator (no model configured) must not be called; callers check {@link
 * #isActive()} and take their fallback path instead.
 */
public interface TextGenerator {

  /** Whether a model is configured and calls can be made. */
  boolean isActive();

  /** Identifier of the underlying model, for logging and status reporting. */
  String modelName();

  /**
   * Generates free text.
   *
   * @param prompt the full prompt
   * @param maxTokens upper bound on generated tokens
   * @param temperature sampling temperature
   * @return generated text, trimmed
   * @throws com.flamingo.ai.rapiddocs.exception.LlmServiceException if the generator is inactive
   *     or the provider call fails
   */
  String generate(String prompt, int maxTokens, double temperature);

  /**
   * Generates a JSON object and binds it to {@code type}.
   *
   * @param prompt prompt that describes the expected JSON structure
   * @param type record or class the JSON is bound to
   * @param maxTokens upper bound on generated tokens
   * @return the bound object, never null
   * @throws com.flamingo.ai.rapiddocs.exception.LlmServiceException if the generator is inactive,
   *     the provider call fails or the response is not valid JSON for {@code type}
   */
  <T> T generateStructured(String prompt, Class<T> type, int maxTokens);
}
