package com.flamingo.ai.rapiddocs.service.extraction;

import java.util.Set;

/**
 * Values that count as "nothing extracted" when merging.
 *
 * <p>They are the defaults the fill pass writes, so an AI echoing a default never beats a real
 * regex match.
 */
public final class PlaceholderSentinels {

  public static final String DEFAULT_VENDOR_NAME = "Professional Services Inc";
  public static final String DEFAULT_VENDOR_ADDRESS = "456 Commerce St\nSan Francisco, CA 94102";
  public static final String DEFAULT_CLIENT_NAME = "Client Company LLC";
  public static final String DEFAULT_CLIENT_ADDRESS = "123 Business Ave\nNew York, NY 10001";

  public static final Set<String> VENDOR_NAMES = Set.of(DEFAULT_VENDOR_NAME, "");
  public static final Set<String> VENDOR_ADDRESSES = Set.of(DEFAULT_VENDOR_ADDRESS, "");
  public static final Set<String> CLIENT_NAMES = Set.of(DEFAULT_CLIENT_NAME, "");
  public static final Set<String> CLIENT_ADDRESSES = Set.of(DEFAULT_CLIENT_ADDRESS, "");

  public static final Set<String> LINE_ITEM_DESCRIPTIONS =
      Set.of("Professional Services", "Consultation Hours", "Service", "");

  public static final Set<String> STATISTIC_NAMES = Set.of("Statistic", "Unnamed", "");

  /** Only the empty string. */
  public static final Set<String> EMPTY = Set.of("");

  private PlaceholderSentinels() {}

  /**
   * Picks the AI value if it carries real data, else the regex value under the same test, else
   * whichever is non-empty.
   */
  public static String pickBest(String aiValue, String regexValue, Set<String> placeholders) {
    String ai = aiValue == null ? "" : aiValue;
    String regex = regexValue == null ? "" : regexValue;
    if (!ai.isEmpty() && !placeholders.contains(ai)) {
      return ai;
    }
    if (!regex.isEmpty() && !placeholders.contains(regex)) {
      return regex;
    }
    return !ai.isEmpty() ? ai : regex;
  }

  /** Returns {@code value}, or {@code fallback} when it is null or empty. */
  public static String orDefault(String value, String fallback) {
    return value == null || value.isEmpty() ? fallback : value;
  }
}
