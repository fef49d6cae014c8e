package com.flamingo.ai.rapiddocs.service.visualization;

import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns statistics into chart images.
 *
 * <p>A statistic carries a single value, so the series each chart type needs is synthesized from
 * it: a pie gets an "Other" slice, a gauge gets a maximum, a line gets a short history ending at
 * the value.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisualizationDispatcher {

  static final String OTHER_SLICE = "Other";
  static final String REMAINING_SLICE = "Remaining";
  static final double NON_PERCENT_GAUGE_HEADROOM = 1.5;

  private final ChartRenderer chartRenderer;
  private final MeterRegistry meterRegistry;

  /**
   * Renders one statistic according to its visualization type.
   *
   * @return {@code outputPath}
   * @throws IOException if the renderer fails to write the image
   */
  public Path render(StatisticEntry stat, List<String> colors, Path outputPath)
      throws IOException {
    log.debug("Rendering {} for '{}'", stat.visualizationType(), stat.name());
    return switch (stat.visualizationType()) {
      case BAR -> chartRenderer.createBarChart(barData(stat), stat.name(), colors, outputPath);
      case PIE -> chartRenderer.createPieChart(pieData(stat), stat.name(), colors, outputPath);
      case GAUGE ->
          chartRenderer.createGaugeChart(
              stat.value(), gaugeMax(stat), stat.name(), colors, outputPath);
      case LINE ->
          chartRenderer.createLineChart(
              Map.of(stat.name(), lineSeries(stat.value(), ThreadLocalRandom.current())),
              stat.name(),
              colors,
              outputPath);
      case NUMBER -> renderNumber(stat, colors, outputPath);
    };
  }

  /**
   * Renders every statistic into {@code directory} as {@code chart_{n}_{type}.png}.
   *
   * <p>A statistic that fails to render is logged and counted; it never affects the others.
   *
   * @return paths of the charts that were written, in statistic order
   */
  public List<Path> renderAll(List<StatisticEntry> stats, List<String> colors, Path directory) {
    List<Path> charts = new ArrayList<>();
    for (int i = 0; i < stats.size(); i++) {
      StatisticEntry stat = stats.get(i);
      String fileName = "chart_" + (i + 1) + "_" + stat.visualizationType().fileSuffix() + ".png";
      Path chartPath = directory.resolve(fileName);
      try {
        Path written = render(stat, colors, chartPath);
        if (written != null && Files.exists(written)) {
          charts.add(written);
        } else {
          log.warn("Renderer reported success for '{}' but wrote no file", stat.name());
          meterRegistry.counter("generation.charts.failure").increment();
        }
      } catch (Exception e) {
        log.warn("Failed to render chart for '{}': {}", stat.name(), e.getMessage());
        meterRegistry.counter("generation.charts.failure").increment();
      }
    }
    log.info("Rendered {}/{} charts", charts.size(), stats.size());
    return charts;
  }

  static Map<String, Double> barData(StatisticEntry stat) {
    return Map.of(stat.name(), stat.value());
  }

  /**
   * A percentage up to 100 gets its complement as the "Other" slice, so the two sum to 100.
   * Anything else is paired with an equal "Other" slice. A statistic itself named "Other" gets a
   * "Remaining" slice instead so the two keys stay distinct.
   */
  static Map<String, Double> pieData(StatisticEntry stat) {
    double remaining =
        stat.isPercentage() && stat.value() <= 100 ? 100 - stat.value() : stat.value();
    Map<String, Double> data = new LinkedHashMap<>();
    data.put(stat.name(), stat.value());
    String complement =
        OTHER_SLICE.equalsIgnoreCase(stat.name().strip()) ? REMAINING_SLICE : OTHER_SLICE;
    data.put(complement, Math.max(0, remaining));
    return data;
  }

  /** 100 for percentages, otherwise 1.5 times the value. */
  static double gaugeMax(StatisticEntry stat) {
    return stat.isPercentage() ? 100 : stat.value() * NON_PERCENT_GAUGE_HEADROOM;
  }

  /** The fraction of the gauge that is filled. */
  static double gaugeFraction(StatisticEntry stat) {
    double max = gaugeMax(stat);
    return max == 0 ? 0 : stat.value() / max;
  }

  /** Five rising points with jitter; the last is exactly {@code value}. */
  static List<Double> lineSeries(double value, Random random) {
    return List.of(
        value * (0.8 + random.nextDouble() * 0.2),
        value * (0.85 + random.nextDouble() * 0.15),
        value * (0.9 + random.nextDouble() * 0.1),
        value * (0.95 + random.nextDouble() * 0.1),
        value);
  }

  private Path renderNumber(StatisticEntry stat, List<String> colors, Path outputPath)
      throws IOException {
    if (chartRenderer.supportsNumberDisplay()) {
      return chartRenderer.createNumberDisplay(
          stat.value(), stat.name(), stat.unit(), colors, outputPath);
    }
    return chartRenderer.createGaugeChart(
        stat.value(),
        stat.value() * NON_PERCENT_GAUGE_HEADROOM,
        stat.name(),
        colors,
        outputPath);
  }
}
