package com.flamingo.ai.deepresearch.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.exception.SchemaValidationException;
import org.springframework.stereotype.Component;

/** Parses JSON text returned by an agent into a typed record. */
@Component
public class StructuredOutputParser {

  private final ObjectMapper objectMapper;

  public StructuredOutputParser(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Parses the raw agent output.
   *
   * @throws SchemaValidationException if the text is blank or not valid JSON for the type
   */
  public <T> T parse(String raw, Class<T> type) {
    if (raw == null || raw.isBlank()) {
      throw new SchemaValidationException(type.getSimpleName(), "Empty structured response");
    }
    try {
      return objectMapper.readValue(stripCodeFence(raw), type);
    } catch (JsonProcessingException e) {
      throw new SchemaValidationException(
          type.getSimpleName(), "Unparseable structured response: " + e.getOriginalMessage(), e);
    }
  }

  private String stripCodeFence(String raw) {
    String text = raw.strip();
    if (text.startsWith("```")) {
      int firstNewline = text.indexOf('\n');
      int lastFence = text.lastIndexOf("```");
      if (firstNewline > 0 && lastFence > firstNewline) {
        return text.substring(firstNewline + 1, lastFence).strip();
      }
    }
    return text;
  }
}
