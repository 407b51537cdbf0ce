package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedReference;
import jakarta.persistence.Converter;

/** Persists {@code List<ExtractedReference>} as a JSON array. */
@Converter
public class ReferenceListConverter extends JsonAttributeConverter<ExtractedReference> {

  public ReferenceListConverter() {
    super(new TypeReference<>() {}, "reference list");
  }
}
