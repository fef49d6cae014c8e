package com.flamingo.ai.rapiddocs.exception;

import java.util.List;

/** Thrown when a generation request is malformed. Raised before any pipeline stage runs. */
public class GenerationValidationException extends RuntimeException {

  private final List<String> errors;

  public GenerationValidationException(List<String> errors) {
    super("Invalid generation request: " + String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
