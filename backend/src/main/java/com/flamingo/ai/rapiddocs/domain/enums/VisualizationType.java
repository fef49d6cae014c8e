package com.flamingo.ai.rapiddocs.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Chart kinds a statistic can be rendered as. */
public enum VisualizationType {
  BAR,
  LINE,
  PIE,
  GAUGE,
  NUMBER;

  /**
   * Resolves a loosely formatted visualization name ({@code "bar_chart"}, {@code "Pie"},
   * {@code "gauge-chart"}) to a type.
   *
   * @param value raw name, may be null
   * @return the matching type, or {@link #BAR} for blank or unknown names
   */
  public static VisualizationType fromName(String value) {
    return parse(value).orElse(BAR);
  }

  /** Returns true if {@code value} names a known type in any of the accepted spellings. */
  public static boolean isKnown(String value) {
    return parse(value).isPresent();
  }

  private static Optional<VisualizationType> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized =
        value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replaceAll("_CHART$", "");
    for (VisualizationType type : values()) {
      if (type.name().equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /** File-name friendly suffix, e.g. {@code bar_chart}. */
  public String fileSuffix() {
    return this == NUMBER ? "number" : name().toLowerCase(Locale.ROOT) + "_chart";
  }
}
