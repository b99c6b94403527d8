package com.flamingo.ai.deepresearch.service.persistence;

/** Exception thrown when a session snapshot cannot be written or read. */
public class PlanStoreException extends RuntimeException {

  public PlanStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
