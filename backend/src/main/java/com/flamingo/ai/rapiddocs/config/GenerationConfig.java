package com.flamingo.ai.rapiddocs.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document generation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "generation")
@Getter
@Setter
public class GenerationConfig {

  /** Directory where charts, illustrations and rendered documents are written. */
  private String outputDir = "generated";

  /** Colour scheme used when a request does not supply one. */
  private List<String> defaultColors = new ArrayList<>(List.of("#1e40af", "#3730a3", "#7c3aed"));

  private Text text = new Text();
  private Extraction extraction = new Extraction();
  private Illustrations illustrations = new Illustrations();

  @Getter
  @Setter
  public static class Text {
    /** Upper bound on tokens requested for report body text. */
    private int maxTokens = 4000;

    private double temperature = 0.7;

    /** Tokens requested for AI-written payment terms and invoice notes. */
    private int shortTextMaxTokens = 200;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Tokens requested for the structured AI extraction call. */
    private int maxTokens = 2000;
  }

  @Getter
  @Setter
  public static class Illustrations {
    /** Number of image requests issued concurrently per batch. */
    private int batchSize = 3;

    /** Pause between batches, to stay under provider rate limits. */
    private long batchPauseMs = 1000;

    private int width = 768;
    private int height = 512;
  }
}
