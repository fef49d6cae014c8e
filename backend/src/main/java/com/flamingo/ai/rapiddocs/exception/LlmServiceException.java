package com.flamingo.ai.rapiddocs.exception;

import java.util.Locale;

/** Exception thrown when the text or image generation provider fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message) {
    super(message);
    this.rateLimited = false;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = isRateLimit(cause);
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static boolean isRateLimit(Throwable cause) {
    for (Throwable current = cause; current != null; current = current.getCause()) {
      String message = current.getMessage();
      if (message != null
          && (message.contains("429") || message.toLowerCase(Locale.ROOT).contains("rate limit"))) {
        return true;
      }
    }
    return false;
  }
}
