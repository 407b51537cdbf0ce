package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedFigure;
import jakarta.persistence.Converter;

/** Persists {@code List<ExtractedFigure>} as a JSON array. */
@Converter
public class FigureListConverter extends JsonAttributeConverter<ExtractedFigure> {

  public FigureListConverter() {
    super(new TypeReference<>() {}, "figure list");
  }
}
