package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/** Persists {@code List<String>} as a JSON array. */
@Converter
public class StringListConverter extends JsonAttributeConverter<String> {

  public StringListConverter() {
    super(new TypeReference<>() {}, "string list");
  }
}
