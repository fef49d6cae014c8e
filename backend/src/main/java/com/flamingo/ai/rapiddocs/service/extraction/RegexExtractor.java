package com.flamingo.ai.rapiddocs.service.extraction;

/**
 * Pattern-based extraction of structured data from a free-text prompt.
 *
 * <p>Implementations are pure functions: they never throw and never call out. Fields the prompt
 * does not mention are left empty.
 *
 * @param <T> extraction result type
 */
public interface RegexExtractor<T> {

  T extract(String prompt);
}
