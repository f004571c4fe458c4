package com.flamingo.ai.adaptiverag.exception;

/** Exception thrown when a language-model call fails or returns an unusable result. */
public class LlmServiceException extends RuntimeException {

  private final String taskKind;

  public LlmServiceException(String taskKind, String message) {
    super(message);
    this.taskKind = taskKind;
  }

  public LlmServiceException(String taskKind, String message, Throwable cause) {
    super(message, cause);
    this.taskKind = taskKind;
  }

  public String getTaskKind() {
    return taskKind;
  }
}
