package com.flamingo.ai.rapiddocs.api.rest;

import com.flamingo.ai.rapiddocs.service.extraction.PromptAnalysisService;
import com.flamingo.ai.rapiddocs.service.generation.ImageGenerator;
import com.flamingo.ai.rapiddocs.service.generation.TextGenerator;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and generator status. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final TextGenerator textGenerator;
  private final ImageGenerator imageGenerator;
  private final PromptAnalysisService promptAnalysisService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "rapiddocs");
    return ResponseEntity.ok(health);
  }

  /** Reports which generators are usable. Inactive generators mean offline fallbacks are used. */
  @GetMapping("/generators")
  public ResponseEntity<Map<String, Object>> generators() {
    Map<String, Object> status = new HashMap<>();
    status.put("textGeneratorActive", textGenerator.isActive());
    status.put("textModel", textGenerator.modelName());
    status.put("imageGeneratorActive", imageGenerator.isActive());
    status.put("extractionMode", promptAnalysisService.extractionMode());
    status.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(status);
  }
}
