package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when a structured LLM response cannot be parsed into the expected shape. */
public class SchemaValidationException extends RuntimeException {

  private final String schema;

  public SchemaValidationException(String schema, String message) {
    super(message);
    this.schema = schema;
  }

  public SchemaValidationException(String schema, String message, Throwable cause) {
    super(message, cause);
    this.schema = schema;
  }

  public String getSchema() {
    return schema;
  }
}
