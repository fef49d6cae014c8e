package com.flamingo.ai.rapiddocs.service.visualization;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Arc2D;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link ChartRenderer} drawing with Java2D into PNG files. */
@Component
@Slf4j
public class Java2dChartRenderer implements ChartRenderer {

  static final int WIDTH = 800;
  static final int HEIGHT = 500;

  private static final int MARGIN = 60;
  private static final int TITLE_HEIGHT = 60;
  private static final Color BACKGROUND = Color.WHITE;
  private static final Color TEXT = new Color(0x1f2937);
  private static final Color GRID = new Color(0xe5e7eb);
  private static final List<Color> FALLBACK_PALETTE =
      List.of(new Color(0x1e40af), new Color(0x3730a3), new Color(0x7c3aed));

  @Override
  public Path createBarChart(
      Map<String, Double> data, String title, List<String> colors, Path outputPath)
      throws IOException {
    List<Color> palette = palette(colors);
    BufferedImage image = newCanvas();
    Graphics2D g = prepare(image);
    try {
      drawTitle(g, title);
      double max = data.values().stream().mapToDouble(Double::doubleValue).max().orElse(1);
      max = max <= 0 ? 1 : max;

      int plotTop = TITLE_HEIGHT + 20;
      int plotBottom = HEIGHT - MARGIN;
      int plotHeight = plotBottom - plotTop;
      int slot = (WIDTH - 2 * MARGIN) / Math.max(1, data.size());
      int barWidth = (int) (slot * 0.6);

      g.setColor(GRID);
      g.drawLine(MARGIN, plotBottom, WIDTH - MARGIN, plotBottom);

      int i = 0;
      for (Map.Entry<String, Double> entry : data.entrySet()) {
        double value = Math.max(0, entry.getValue());
        int barHeight = (int) Math.round(plotHeight * (value / max));
        int x = MARGIN + i * slot + (slot - barWidth) / 2;
        g.setColor(palette.get(i % palette.size()));
        g.fillRect(x, plotBottom - barHeight, barWidth, barHeight);

        g.setColor(TEXT);
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 16));
        drawCentered(
            g, format(entry.getValue()), x + barWidth / 2, plotBottom - barHeight - 8);
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 14));
        drawCentered(g, entry.getKey(), x + barWidth / 2, plotBottom + 22);
        i++;
      }
    } finally {
      g.dispose();
    }
    return write(image, outputPath);
  }

  @Override
  public Path createLineChart(
      Map<String, List<Double>> series, String title, List<String> colors, Path outputPath)
      throws IOException {
    List<Color> palette = palette(colors);
    BufferedImage image = newCanvas();
    Graphics2D g = prepare(image);
    try {
      drawTitle(g, title);
      double min = Double.MAX_VALUE;
      double max = -Double.MAX_VALUE;
      int points = 0;
      for (List<Double> values : series.values()) {
        for (double v : values) {
          min = Math.min(min, v);
          max = Math.max(max, v);
        }
        points = Math.max(points, values.size());
      }
      if (points == 0) {
        return write(image, outputPath);
      }
      double range = max - min == 0 ? Math.max(1, Math.abs(max)) : max - min;

      int plotTop = TITLE_HEIGHT + 20;
      int plotBottom = HEIGHT - MARGIN;
      int plotWidth = WIDTH - 2 * MARGIN;
      int plotHeight = plotBottom - plotTop;

      g.setColor(GRID);
      for (int line = 0; line <= 4; line++) {
        int y = plotBottom - plotHeight * line / 4;
        g.drawLine(MARGIN, y, WIDTH - MARGIN, y);
      }

      int s = 0;
      for (List<Double> values : series.values()) {
        Color color = palette.get(s % palette.size());
        Path2D.Double path = new Path2D.Double();
        List<int[]> markers = new ArrayList<>();
        for (int p = 0; p < values.size(); p++) {
          double x = MARGIN + (points == 1 ? plotWidth / 2.0 : plotWidth * p / (points - 1.0));
          double y = plotBottom - plotHeight * ((values.get(p) - min) / range);
          if (p == 0) {
            path.moveTo(x, y);
          } else {
            path.lineTo(x, y);
          }
          markers.add(new int[] {(int) x, (int) y});
        }
        g.setColor(color);
        g.setStroke(new BasicStroke(3f));
        g.draw(path);
        for (int[] marker : markers) {
          g.fillOval(marker[0] - 5, marker[1] - 5, 10, 10);
        }
        s++;
      }

      List<Double> first = series.values().iterator().next();
      g.setColor(TEXT);
      g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 16));
      drawCentered(
          g, format(first.get(first.size() - 1)), WIDTH - MARGIN, plotTop - 4);
    } finally {
      g.dispose();
    }
    return write(image, outputPath);
  }

  @Override
  public Path createPieChart(
      Map<String, Double> data, String title, List<String> colors, Path outputPath)
      throws IOException {
    List<Color> palette = palette(colors);
    BufferedImage image = newCanvas();
    Graphics2D g = prepare(image);
    try {
      drawTitle(g, title);
      double total = data.values().stream().mapToDouble(v -> Math.max(0, v)).sum();
      int diameter = HEIGHT - TITLE_HEIGHT - 2 * 30;
      int x = MARGIN;
      int y = TITLE_HEIGHT + 30;

      double start = 90;
      int i = 0;
      int legendY = y + 30;
      for (Map.Entry<String, Double> entry : data.entrySet()) {
        double value = Math.max(0, entry.getValue());
        double extent = total == 0 ? 0 : -360.0 * value / total;
        Color color = palette.get(i % palette.size());
        g.setColor(color);
        g.fill(new Arc2D.Double(x, y, diameter, diameter, start, extent, Arc2D.PIE));
        start += extent;

        int legendX = x + diameter + 50;
        g.fillRect(legendX, legendY - 14, 18, 18);
        g.setColor(TEXT);
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 16));
        String share = total == 0 ? "0" : format(100 * value / total);
        g.drawString(entry.getKey() + " (" + share + "%)", legendX + 28, legendY);
        legendY += 32;
        i++;
      }
    } finally {
      g.dispose();
    }
    return write(image, outputPath);
  }

  @Override
  public Path createGaugeChart(
      double value, double maxValue, String title, List<String> colors, Path outputPath)
      throws IOException {
    List<Color> palette = palette(colors);
    double fraction = maxValue <= 0 ? 0 : Math.max(0, Math.min(1, value / maxValue));
    BufferedImage image = newCanvas();
    Graphics2D g = prepare(image);
    try {
      drawTitle(g, title);
      int diameter = 360;
      int x = (WIDTH - diameter) / 2;
      int y = TITLE_HEIGHT + 40;

      g.setStroke(new BasicStroke(40f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER));
      g.setColor(GRID);
      g.draw(new Arc2D.Double(x, y, diameter, diameter, 180, -180, Arc2D.OPEN));
      g.setColor(palette.get(0));
      g.draw(new Arc2D.Double(x, y, diameter, diameter, 180, -180 * fraction, Arc2D.OPEN));

      g.setColor(TEXT);
      g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 40));
      drawCentered(g, format(value), WIDTH / 2, y + diameter / 2 - 10);
      g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 16));
      drawCentered(
          g,
          format(fraction * 100) + "% of " + format(maxValue),
          WIDTH / 2,
          y + diameter / 2 + 24);
    } finally {
      g.dispose();
    }
    return write(image, outputPath);
  }

  @Override
  public boolean supportsNumberDisplay() {
    return true;
  }

  @Override
  public Path createNumberDisplay(
      double value, String label, String unit, List<String> colors, Path outputPath)
      throws IOException {
    List<Color> palette = palette(colors);
    BufferedImage image = newCanvas();
    Graphics2D g = prepare(image);
    try {
      g.setColor(palette.get(0));
      g.fillRoundRect(MARGIN, MARGIN, WIDTH - 2 * MARGIN, HEIGHT - 2 * MARGIN, 40, 40);
      g.setColor(Color.WHITE);
      g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 96));
      drawCentered(g, format(value), WIDTH / 2, HEIGHT / 2 + 10);
      g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 28));
      String caption = unit == null || unit.isBlank() ? label : label + " (" + unit + ")";
      drawCentered(g, caption, WIDTH / 2, HEIGHT / 2 + 70);
    } finally {
      g.dispose();
    }
    return write(image, outputPath);
  }

  /** Parses the hex colours, skipping malformed ones. */
  static List<Color> palette(List<String> colors) {
    List<Color> palette = new ArrayList<>();
    if (colors != null) {
      for (String hex : colors) {
        if (hex == null) {
          continue;
        }
        try {
          palette.add(Color.decode(hex.trim()));
        } catch (NumberFormatException e) {
          log.debug("Ignoring invalid chart colour '{}'", hex);
        }
      }
    }
    return palette.isEmpty() ? FALLBACK_PALETTE : palette;
  }

  private static String format(double value) {
    return new DecimalFormat("#,##0.##").format(value);
  }

  private static BufferedImage newCanvas() {
    return new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
  }

  private static Graphics2D prepare(BufferedImage image) {
    Graphics2D g = image.createGraphics();
    g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
    g.setRenderingHint(
        RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
    g.setColor(BACKGROUND);
    g.fillRect(0, 0, image.getWidth(), image.getHeight());
    return g;
  }

  private static void drawTitle(Graphics2D g, String title) {
    g.setColor(TEXT);
    g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 24));
    drawCentered(g, title == null ? "" : title, WIDTH / 2, TITLE_HEIGHT - 15);
  }

  private static void drawCentered(Graphics2D g, String text, int centerX, int baselineY) {
    FontMetrics metrics = g.getFontMetrics();
    g.drawString(text, centerX - metrics.stringWidth(text) / 2, baselineY);
  }

  private static Path write(BufferedImage image, Path outputPath) throws IOException {
    Path parent = outputPath.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (!ImageIO.write(image, "png", outputPath.toFile())) {
      throw new IOException("No PNG writer available for " + outputPath);
    }
    log.debug("Chart written: {}", outputPath.getFileName());
    return outputPath;
  }
}
