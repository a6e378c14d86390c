package com.flamingo.ai.docindex.domain.enums;

/** Strength class of a semantic boundary between two adjacent text units. */
public enum BoundaryType {
  WEAK,
  MODERATE,
  STRONG
}
