package com.flamingo.ai.adaptiverag.exception;

/**
 * Exception thrown when a workflow request carries invalid or conflicting options. Raised before
 * any stage runs; it is the only error {@code run} surfaces to its caller.
 */
public class InvalidWorkflowOptionsException extends RuntimeException {

  private final String field;

  public InvalidWorkflowOptionsException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  public String getUserMessage() {
    return getMessage();
  }
}
