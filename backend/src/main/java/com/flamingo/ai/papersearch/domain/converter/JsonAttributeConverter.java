package com.flamingo.ai.papersearch.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Base JPA converter persisting a list attribute as a JSON array in a TEXT column.
 *
 * <p>An empty list is stored as {@code null}; a {@code null} or unreadable column reads back as an
 * empty list.
 *
 * @param <T> element type
 */
@Slf4j
public abstract class JsonAttributeConverter<T> implements AttributeConverter<List<T>, String> {

  protected static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<List<T>> listType;
  private final String description;

  protected JsonAttributeConverter(TypeReference<List<T>> listType, String description) {
    this.listType = listType;
    this.description = description;
  }

  @Override
  public String convertToDatabaseColumn(List<T> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize {}: {}", description, e.getMessage());
      return null;
    }
  }

  @Override
  public List<T> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return MAPPER.readValue(dbData, listType);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize {}: {}", description, e.getMessage());
      return Collections.emptyList();
    }
  }
}
