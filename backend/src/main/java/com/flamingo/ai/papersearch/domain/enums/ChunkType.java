package com.flamingo.ai.papersearch.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of content a chunk was cut from. */
public enum ChunkType {
  TEXT("text"),
  TABLE("table"),
  REFERENCE("reference");

  private final String value;

  ChunkType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Resolves a chunk type from its wire value, ignoring case.
   *
   * @param value the wire value, e.g. "reference"
   * @return the matching type
   * @throws IllegalArgumentException if the value is unknown
   */
  @JsonCreator
  public static ChunkType fromValue(String value) {
    for (ChunkType type : values()) {
      if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown chunk type: " + value);
  }
}
