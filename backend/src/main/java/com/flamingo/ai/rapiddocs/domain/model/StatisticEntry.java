package com.flamingo.ai.rapiddocs.domain.model;

import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;

/**
 * A single statistic to be visualized in a report.
 *
 * <p>Created by extraction or import, merged into a {@link ReportExtraction} and consumed once by
 * the visualization stage.
 */
public record StatisticEntry(
    String name,
    double value,
    String unit,
    VisualizationType visualizationType,
    String category, // optional
    String description // optional
    ) {

  public StatisticEntry {
    name = name == null ? "" : name;
    unit = unit == null ? "" : unit;
    visualizationType = visualizationType == null ? VisualizationType.BAR : visualizationType;
  }

  public StatisticEntry(String name, double value, String unit, VisualizationType type) {
    this(name, value, unit, type, null, null);
  }

  public boolean isPercentage() {
    return "%".equals(unit.trim());
  }
}
