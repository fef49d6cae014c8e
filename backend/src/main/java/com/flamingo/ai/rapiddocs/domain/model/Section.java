package com.flamingo.ai.rapiddocs.domain.model;

/** A document section: heading plus body text. */
public record Section(String heading, String body) {

  public int wordCount() {
    if (body == null || body.isBlank()) {
      return 0;
    }
    return body.trim().split("\\s+").length;
  }
}
