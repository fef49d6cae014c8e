package com.flamingo.ai.rapiddocs.service.illustration;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.springframework.stereotype.Component;

/** Draws the stand-in image used when an illustration cannot be generated. */
@Component
public class PlaceholderImageFactory {

  private static final Color BACKGROUND = new Color(0xf0f4f8);
  private static final Color BORDER = new Color(0x1e40af);
  private static final Color CAPTION = new Color(0x64748b);
  private static final int EXCERPT_LENGTH = 50;

  public Path create(String prompt, Path outputPath, int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g.setRenderingHint(
          RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      g.setColor(BACKGROUND);
      g.fillRect(0, 0, width, height);
      g.setColor(BORDER);
      g.setStroke(new BasicStroke(4f));
      g.drawRect(10, 10, width - 20, height - 20);

      g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(12, height / 16)));
      drawCentered(g, "Image Placeholder", width / 2, height / 2);
      g.setColor(CAPTION);
      g.setFont(new Font(Font.SANS_SERIF, Font.ITALIC, Math.max(10, height / 32)));
      drawCentered(g, excerpt(prompt), width / 2, height / 2 + Math.max(20, height / 12));
    } finally {
      g.dispose();
    }

    Files.createDirectories(outputPath.toAbsolutePath().getParent());
    if (!ImageIO.write(image, "png", outputPath.toFile())) {
      throw new IOException("No PNG writer available for " + outputPath);
    }
    return outputPath;
  }

  static String excerpt(String prompt) {
    if (prompt == null || prompt.isBlank()) {
      return "";
    }
    String trimmed = prompt.strip();
    return trimmed.length() <= EXCERPT_LENGTH
        ? trimmed
        : trimmed.substring(0, EXCERPT_LENGTH) + "...";
  }

  private static void drawCentered(Graphics2D g, String text, int centerX, int baselineY) {
    FontMetrics metrics = g.getFontMetrics();
    g.drawString(text, centerX - metrics.stringWidth(text) / 2, baselineY);
  }
}
