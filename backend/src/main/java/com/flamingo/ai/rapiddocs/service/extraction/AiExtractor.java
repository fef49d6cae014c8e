package com.flamingo.ai.rapiddocs.service.extraction;

/**
 * Model-based extraction of structured data from a free-text prompt.
 *
 * @param <T> extraction result type
 */
public interface AiExtractor<T> {

  /**
   * Extracts structured data.
   *
   * @param prompt the user prompt
   * @return the extraction, or an all-empty result when the generator is inactive, fails or
   *     returns output that cannot be bound. Never throws.
   */
  T extract(String prompt);
}
