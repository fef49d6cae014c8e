package com.flamingo.ai.rapiddocs.service.extraction;

/**
 * Reconciles an AI extraction with a regex extraction and fills what neither found.
 *
 * @param <T> extraction result type
 */
public interface ExtractionMerger<T> {

  /**
   * Merges field by field, preferring real AI values, then applies {@link #fillDefaults}.
   *
   * @param ai result of the AI extractor, possibly all-empty
   * @param regex result of the regex extractor
   * @return a result with every scalar non-empty
   */
  T merge(T ai, T regex);

  /** Replaces empty fields with defaults and normalizes numeric ranges. */
  T fillDefaults(T result);
}
