package com.flamingo.ai.rapiddocs.domain.enums;

/**
 * The five stages of a generation job, in execution order.
 *
 * <p>Critical stages abort the job when they fail. Best-effort stages absorb their failures and
 * yield an empty (or partial) artifact list instead.
 */
public enum GenerationStage {
  ANALYZE(true),
  GENERATE_TEXT(true),
  GENERATE_CHARTS(false),
  GENERATE_ILLUSTRATIONS(false),
  RENDER(true);

  private final boolean critical;

  GenerationStage(boolean critical) {
    this.critical = critical;
  }

  public boolean isCritical() {
    return critical;
  }
}
