package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/** Persists {@code List<Float>} as a JSON array. */
@Converter
public class FloatListConverter extends JsonAttributeConverter<Float> {

  public FloatListConverter() {
    super(new TypeReference<>() {}, "float list");
  }
}
