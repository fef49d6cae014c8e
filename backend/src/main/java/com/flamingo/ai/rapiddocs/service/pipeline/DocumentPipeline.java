package com.flamingo.ai.rapiddocs.service.pipeline;

import com.flamingo.ai.rapiddocs.api.dto.request.GenerationRequest;
import com.flamingo.ai.rapiddocs.domain.enums.DocumentType;
import com.flamingo.ai.rapiddocs.domain.model.Section;
import com.flamingo.ai.rapiddocs.service.render.RenderRequest;
import java.nio.file.Path;
import java.util.List;

/**
 * Stage implementations for one document type. {@link GenerationOrchestrator} decides the order,
 * the concurrency and how failures are treated.
 *
 * @param <R> request type
 * @param <D> draft produced by analysis and carried through the later stages
 */
public interface DocumentPipeline<R extends GenerationRequest, D> {

  DocumentType documentType();

  Class<R> requestType();

  /** Checks that Bean Validation cannot express. Returns human-readable errors, empty if valid. */
  List<String> validate(R request);

  D analyze(R request, GenerationJob job);

  List<Section> generateText(D draft, GenerationJob job);

  List<Path> generateCharts(D draft, GenerationJob job);

  List<Path> generateIllustrations(D draft, GenerationJob job);

  RenderRequest renderRequest(
      D draft,
      List<Section> sections,
      List<Path> charts,
      List<Path> illustrations,
      GenerationJob job);
}
