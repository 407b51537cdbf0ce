package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/** Persists {@code List<Integer>} as a JSON array. */
@Converter
public class IntegerListConverter extends JsonAttributeConverter<Integer> {

  public IntegerListConverter() {
    super(new TypeReference<>() {}, "integer list");
  }
}
