package com.flamingo.ai.rapiddocs.service.render;

import com.flamingo.ai.rapiddocs.domain.model.Section;
import java.awt.Color;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

/**
 * Lays out a document as a simple flowing PDF: optional cover page, then each section followed by
 * its illustration, then the charts.
 */
@Component
@Slf4j
public class PdfBoxDocumentRenderer implements DocumentRenderer {

  private static final PDRectangle PAGE_SIZE = PDRectangle.LETTER;
  private static final float MARGIN = 56f;
  private static final float CONTENT_WIDTH = PAGE_SIZE.getWidth() - 2 * MARGIN;
  private static final float MAX_IMAGE_HEIGHT = 280f;

  private static final float TITLE_SIZE = 24f;
  private static final float HEADING_SIZE = 15f;
  private static final float BODY_SIZE = 11f;
  private static final float LEADING = 1.45f;

  private static final Color TEXT = new Color(0x1f2937);
  private static final Color DEFAULT_ACCENT = new Color(0x1e40af);

  @Override
  public Path render(RenderRequest request) throws IOException {
    PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    Color accent = accentColor(request.colors());

    try (PDDocument document = new PDDocument()) {
      applyDocumentInformation(document, request);
      if (request.includeCover()) {
        writeCoverPage(document, request, bold, regular, accent);
      }

      try (PageCursor cursor = new PageCursor(document)) {
        if (!request.includeCover()) {
          cursor.paragraph(request.title(), bold, TITLE_SIZE, accent);
          cursor.space(BODY_SIZE);
        }

        List<Section> sections = request.sections();
        List<Path> illustrations = request.illustrationPaths();
        for (int i = 0; i < sections.size(); i++) {
          Section section = sections.get(i);
          cursor.space(BODY_SIZE);
          cursor.paragraph(section.heading(), bold, HEADING_SIZE, accent);
          for (String paragraph : section.body().split("\\n\\s*\\n|\\n")) {
            if (!paragraph.isBlank()) {
              cursor.paragraph(paragraph.strip(), regular, BODY_SIZE, TEXT);
              cursor.space(BODY_SIZE * 0.4f);
            }
          }
          if (i < illustrations.size()) {
            cursor.image(illustrations.get(i));
          }
        }
        for (int i = sections.size(); i < illustrations.size(); i++) {
          cursor.image(illustrations.get(i));
        }

        if (!request.chartPaths().isEmpty()) {
          cursor.space(BODY_SIZE);
          cursor.paragraph("Key Figures", bold, HEADING_SIZE, accent);
          for (Path chart : request.chartPaths()) {
            cursor.image(chart);
          }
        }
      }

      Path parent = request.outputPath().toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      document.save(request.outputPath().toFile());
      log.info(
          "Rendered {} ({} pages, {} sections, {} charts, {} illustrations)",
          request.outputPath().getFileName(),
          document.getNumberOfPages(),
          request.sections().size(),
          request.chartPaths().size(),
          request.illustrationPaths().size());
    }
    return request.outputPath();
  }

  private static void applyDocumentInformation(PDDocument document, RenderRequest request) {
    PDDocumentInformation info = document.getDocumentInformation();
    info.setTitle(request.title());
    info.setAuthor(metadataValue(request, "author", "RapidDocs"));
    info.setCreator("RapidDocs");
    info.setCreationDate(Calendar.getInstance());
    info.setSubject(metadataValue(request, "topic", null));
  }

  private static String metadataValue(RenderRequest request, String key, String fallback) {
    return request.metadata().entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(key))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(fallback);
  }

  private static void writeCoverPage(
      PDDocument document, RenderRequest request, PDFont bold, PDFont regular, Color accent)
      throws IOException {
    PDPage page = new PDPage(PAGE_SIZE);
    document.addPage(page);
    float height = PAGE_SIZE.getHeight();
    try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
      stream.setNonStrokingColor(accent);
      stream.addRect(0, height - 260, PAGE_SIZE.getWidth(), 260);
      stream.fill();

      float y = height - 140;
      for (String line : wrap(request.title(), bold, 30f, CONTENT_WIDTH)) {
        showText(stream, line, bold, 30f, Color.WHITE, MARGIN, y);
        y -= 30f * 1.25f;
      }

      y = height - 320;
      for (Map.Entry<String, String> entry : request.metadata().entrySet()) {
        String line = sanitize(capitalize(entry.getKey()) + ": " + entry.getValue(), regular);
        showText(stream, line, regular, 13f, TEXT, MARGIN, y);
        y -= 13f * LEADING;
      }

      if (request.logoPath() != null && Files.isRegularFile(request.logoPath())) {
        try {
          PDImageXObject logo =
              PDImageXObject.createFromFile(request.logoPath().toString(), document);
          float scale = Math.min(120f / logo.getWidth(), 80f / logo.getHeight());
          float w = logo.getWidth() * scale;
          float h = logo.getHeight() * scale;
          stream.drawImage(logo, PAGE_SIZE.getWidth() - MARGIN - w, height - 40 - h, w, h);
        } catch (IOException | IllegalArgumentException e) {
          log.warn("Skipping unreadable logo {}: {}", request.logoPath(), e.getMessage());
        }
      }
    }
  }

  private static Color accentColor(List<String> colors) {
    for (String hex : colors) {
      if (hex == null) {
        continue;
      }
      try {
        return Color.decode(hex.trim());
      } catch (NumberFormatException e) {
        log.debug("Ignoring invalid accent colour '{}'", hex);
      }
    }
    return DEFAULT_ACCENT;
  }

  private static void showText(
      PDPageContentStream stream,
      String text,
      PDFont font,
      float size,
      Color color,
      float x,
      float y)
      throws IOException {
    stream.beginText();
    stream.setFont(font, size);
    stream.setNonStrokingColor(color);
    stream.newLineAtOffset(x, y);
    stream.showText(text);
    stream.endText();
  }

  private static String capitalize(String key) {
    return key.isEmpty() ? key : Character.toUpperCase(key.charAt(0)) + key.substring(1);
  }

  /** Greedy word wrap; text is first reduced to characters the font can encode. */
  static List<String> wrap(String text, PDFont font, float size, float width) throws IOException {
    List<String> lines = new ArrayList<>();
    StringBuilder line = new StringBuilder();
    for (String word : sanitize(text, font).split("\\s+")) {
      if (word.isEmpty()) {
        continue;
      }
      String candidate = line.length() == 0 ? word : line + " " + word;
      if (line.length() > 0 && textWidth(candidate, font, size) > width) {
        lines.add(line.toString());
        line = new StringBuilder(word);
      } else {
        line = new StringBuilder(candidate);
      }
    }
    if (line.length() > 0) {
      lines.add(line.toString());
    }
    return lines;
  }

  /** Replaces control characters with spaces and unencodable characters with '?'. */
  static String sanitize(String text, PDFont font) {
    StringBuilder out = new StringBuilder();
    text.codePoints()
        .forEach(
            cp -> {
              if (Character.isISOControl(cp)) {
                out.append(' ');
                return;
              }
              String ch = new String(Character.toChars(cp));
              try {
                font.encode(ch);
                out.append(ch);
              } catch (IOException | IllegalArgumentException e) {
                out.append('?');
              }
            });
    return out.toString();
  }

  private static float textWidth(String text, PDFont font, float size) throws IOException {
    return font.getStringWidth(text) / 1000f * size;
  }

  /** Tracks the write position and opens new pages as content flows down. */
  private static final class PageCursor implements Closeable {

    private final PDDocument document;
    private PDPageContentStream stream;
    private float y;

    PageCursor(PDDocument document) throws IOException {
      this.document = document;
      newPage();
    }

    void paragraph(String text, PDFont font, float size, Color color) throws IOException {
      for (String line : wrap(text, font, size, CONTENT_WIDTH)) {
        ensureSpace(size * LEADING);
        showText(stream, line, font, size, color, MARGIN, y - size);
        y -= size * LEADING;
      }
    }

    void space(float amount) {
      y -= amount;
    }

    void image(Path path) throws IOException {
      if (path == null || !Files.isRegularFile(path)) {
        log.warn("Skipping missing image {}", path);
        return;
      }
      PDImageXObject image;
      try {
        image = PDImageXObject.createFromFile(path.toString(), document);
      } catch (IOException | IllegalArgumentException e) {
        log.warn("Skipping unreadable image {}: {}", path.getFileName(), e.getMessage());
        return;
      }
      float scale =
          Math.min(CONTENT_WIDTH / image.getWidth(), MAX_IMAGE_HEIGHT / image.getHeight());
      float w = image.getWidth() * scale;
      float h = image.getHeight() * scale;
      ensureSpace(h + BODY_SIZE);
      y -= BODY_SIZE / 2;
      stream.drawImage(image, MARGIN + (CONTENT_WIDTH - w) / 2, y - h, w, h);
      y -= h + BODY_SIZE / 2;
    }

    private void ensureSpace(float height) throws IOException {
      if (y - height < MARGIN) {
        newPage();
      }
    }

    private void newPage() throws IOException {
      if (stream != null) {
        stream.close();
      }
      PDPage page = new PDPage(PAGE_SIZE);
      document.addPage(page);
      stream = new PDPageContentStream(document, page);
      y = PAGE_SIZE.getHeight() - MARGIN;
    }

    @Override
    public void close() throws IOException {
      if (stream != null) {
        stream.close();
        stream = null;
      }
    }
  }
}
