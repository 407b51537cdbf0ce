package com.flamingo.ai.papersearch.domain.enums;

/** Outcome of one extraction stage (text, tables, figures or references). */
public enum StageStatus {
  PENDING,
  DONE,
  FAILED
}
