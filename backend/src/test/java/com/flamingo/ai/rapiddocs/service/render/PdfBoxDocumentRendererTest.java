package com.flamingo.ai.rapiddocs.service.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.rapiddocs.domain.model.Section;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import javax.imageio.ImageIO;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfBoxDocumentRendererTest {

  private final PdfBoxDocumentRenderer renderer = new PdfBoxDocumentRenderer();
  private final PDFont helvetica = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

  @TempDir Path dir;

  @Test
  void shouldRenderCoverSectionsAndImages() throws IOException {
    Path illustration = png("illustration_1.png", 300, 200);
    Path chart = png("chart_1_bar_chart.png", 800, 500);
    RenderRequest request =
        RenderRequest.builder()
            .title("Remote Work – 2024")
            .sections(
                List.of(
                    new Section("Overview", "Remote work keeps growing.\nIt is here to stay."),
                    new Section("Data", "word ".repeat(1500))))
            .illustrationPaths(List.of(illustration))
            .chartPaths(List.of(chart))
            .outputPath(dir.resolve("out/infographic_abc12345_Remote_Work.pdf"))
            .includeCover(true)
            .metadata(Map.of("Author", "Analytics Team"))
            .colors(List.of("#0f766e"))
            .build();

    Path output = renderer.render(request);

    assertThat(output).isRegularFile();
    try (PDDocument document = Loader.loadPDF(output.toFile())) {
      assertThat(document.getNumberOfPages()).isGreaterThanOrEqualTo(3);
      assertThat(document.getDocumentInformation().getTitle()).isEqualTo("Remote Work – 2024");
      assertThat(document.getDocumentInformation().getAuthor()).isEqualTo("Analytics Team");
    }
  }

  @Test
  void shouldRenderWithoutCoverOrImages() throws IOException {
    RenderRequest request =
        RenderRequest.builder()
            .title("Invoice INV-1")
            .sections(List.of(new Section("Bill To", "Widgets Inc\n2 Oak Ave")))
            .outputPath(dir.resolve("invoice.pdf"))
            .includeCover(false)
            .build();

    Path output = renderer.render(request);

    try (PDDocument document = Loader.loadPDF(output.toFile())) {
      assertThat(document.getNumberOfPages()).isEqualTo(1);
    }
  }

  @Test
  void shouldReplaceCharactersTheFontCannotEncode() {
    assertThat(PdfBoxDocumentRenderer.sanitize("a\tb日é", helvetica)).isEqualTo("a b?é");
  }

  @Test
  void shouldWrapToWidth() throws IOException {
    List<String> lines =
        PdfBoxDocumentRenderer.wrap("alpha beta gamma delta epsilon zeta", helvetica, 12, 80);

    assertThat(lines).hasSizeGreaterThan(1);
    assertThat(String.join(" ", lines)).isEqualTo("alpha beta gamma delta epsilon zeta");
  }

  private Path png(String name, int width, int height) throws IOException {
    Path path = dir.resolve(name);
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    ImageIO.write(image, "png", path.toFile());
    return path;
  }
}
