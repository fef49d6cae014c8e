package com.flamingo.ai.rapiddocs.domain.enums;

/** Transient status of a single stage within a generation job. */
public enum StageStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  DEGRADED,
  FAILED
}
