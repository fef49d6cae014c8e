package com.flamingo.ai.rapiddocs.service.render;

import java.io.IOException;
import java.nio.file.Path;

/** Writes the final document file. */
public interface DocumentRenderer {

  /**
   * Renders the document described by {@code request} to {@link RenderRequest#outputPath()}.
   *
   * @return the written file
   * @throws IOException if the document cannot be written
   */
  Path render(RenderRequest request) throws IOException;
}
