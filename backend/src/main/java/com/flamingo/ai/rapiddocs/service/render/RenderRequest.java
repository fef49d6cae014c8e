package com.flamingo.ai.rapiddocs.service.render;

import com.flamingo.ai.rapiddocs.domain.model.Section;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/** Everything the renderer needs to lay out one document. */
@Builder
public record RenderRequest(
    String title,
    List<Section> sections,
    List<Path> chartPaths,
    List<Path> illustrationPaths,
    Path outputPath,
    Path logoPath, // optional
    boolean includeCover,
    Map<String, String> metadata, // insertion order is kept
    List<String> colors) {

  public RenderRequest {
    title = title == null ? "" : title;
    sections = sections == null ? List.of() : List.copyOf(sections);
    chartPaths = chartPaths == null ? List.of() : List.copyOf(chartPaths);
    illustrationPaths = illustrationPaths == null ? List.of() : List.copyOf(illustrationPaths);
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    colors = colors == null ? List.of() : List.copyOf(colors);
  }
}
