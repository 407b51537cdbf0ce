package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import jakarta.persistence.Converter;

/** Persists {@code List<SectionText>} as a JSON array. */
@Converter
public class SectionListConverter extends JsonAttributeConverter<SectionText> {

  public SectionListConverter() {
    super(new TypeReference<>() {}, "section list");
  }
}
