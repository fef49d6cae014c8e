package com.flamingo.ai.rapiddocs.api.dto.request;

import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A statistic supplied explicitly with a report request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticRequest {

  @NotBlank(message = "Statistic name is required")
  @Size(max = 100, message = "Statistic name must not exceed 100 characters")
  private String name;

  @NotNull(message = "Statistic value is required")
  private Double value;

  private String unit;

  /** bar, line, pie, gauge or number, with or without a "_chart" suffix. Defaults to bar. */
  private String visualizationType;

  private String category;
  private String description;

  public StatisticEntry toEntry() {
    return new StatisticEntry(
        name,
        value,
        unit == null || unit.isBlank() ? "units" : unit,
        VisualizationType.fromName(visualizationType),
        category,
        description);
  }
}
