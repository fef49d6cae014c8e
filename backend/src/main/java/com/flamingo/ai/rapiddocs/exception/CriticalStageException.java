package com.flamingo.ai.rapiddocs.exception;

import com.flamingo.ai.rapiddocs.domain.enums.GenerationStage;

/** Exception thrown when a critical pipeline stage fails and the job is aborted. */
public class CriticalStageException extends RuntimeException {

  private final GenerationStage stage;
  private final String jobId;
  private final String userMessage;

  public CriticalStageException(GenerationStage stage, String jobId, Throwable cause) {
    super(
        String.format(
            "Job %s failed at stage %s: %s",
            jobId, stage, cause != null ? cause.getMessage() : "unknown error"),
        cause);
    this.stage = stage;
    this.jobId = jobId;
    this.userMessage = "Document generation failed during " + describe(stage) + ".";
  }

  public GenerationStage getStage() {
    return stage;
  }

  public String getJobId() {
    return jobId;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static String describe(GenerationStage stage) {
    return switch (stage) {
      case ANALYZE -> "prompt analysis";
      case GENERATE_TEXT -> "text generation";
      case RENDER -> "rendering";
      default -> stage.name().toLowerCase().replace('_', ' ');
    };
  }
}
