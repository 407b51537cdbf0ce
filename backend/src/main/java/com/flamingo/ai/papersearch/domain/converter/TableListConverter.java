package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedTable;
import jakarta.persistence.Converter;

/** Persists {@code List<ExtractedTable>} as a JSON array. */
@Converter
public class TableListConverter extends JsonAttributeConverter<ExtractedTable> {

  public TableListConverter() {
    super(new TypeReference<>() {}, "table list");
  }
}
