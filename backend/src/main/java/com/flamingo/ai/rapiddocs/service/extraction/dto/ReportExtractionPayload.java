package com.flamingo.ai.rapiddocs.service.extraction.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Structured output of the report extraction prompt. All fields optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportExtractionPayload(
    String title,
    String topic,
    @JsonProperty("word_count") @JsonAlias("wordCount") Integer wordCount,
    @JsonProperty("num_sections") @JsonAlias({"numSections", "section_count"}) Integer numSections,
    String tone,
    List<Statistic> statistics,
    @JsonProperty("image_prompts") @JsonAlias("imagePrompts") List<String> imagePrompts,
    @JsonProperty("section_outlines") @JsonAlias("sectionOutlines") List<String> sectionOutlines,
    @JsonProperty("color_suggestions") @JsonAlias("colorSuggestions")
        List<String> colorSuggestions) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Statistic(
      String name,
      Double value,
      String unit,
      @JsonProperty("visualization_type") @JsonAlias("visualizationType")
          String visualizationType, // e.g. "bar_chart"
      String category,
      String description) {}
}
