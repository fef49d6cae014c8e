package com.flamingo.ai.rapiddocs.service.visualization;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Draws chart images. Each method writes a PNG to {@code outputPath} and returns that path.
 *
 * <p>Colours are hex strings such as {@code #1e40af}; implementations cycle through them.
 */
public interface ChartRenderer {

  Path createBarChart(Map<String, Double> data, String title, List<String> colors, Path outputPath)
      throws IOException;

  /** One polyline per entry, points in order. */
  Path createLineChart(
      Map<String, List<Double>> series, String title, List<String> colors, Path outputPath)
      throws IOException;

  Path createPieChart(Map<String, Double> data, String title, List<String> colors, Path outputPath)
      throws IOException;

  /** Semicircular gauge filled to {@code value / maxValue}. */
  Path createGaugeChart(
      double value, double maxValue, String title, List<String> colors, Path outputPath)
      throws IOException;

  /** Whether {@link #createNumberDisplay} is implemented. */
  default boolean supportsNumberDisplay() {
    return false;
  }

  /** Renders a single prominent figure with its label and unit. */
  default Path createNumberDisplay(
      double value, String label, String unit, List<String> colors, Path outputPath)
      throws IOException {
    throw new UnsupportedOperationException("Number display is not supported by this renderer");
  }
}
