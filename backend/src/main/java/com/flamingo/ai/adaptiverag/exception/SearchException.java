package com.flamingo.ai.adaptiverag.exception;

/** Exception thrown when the knowledge store or the web search provider fails. */
public class SearchException extends RuntimeException {

  private final String source;

  public SearchException(String source, String message) {
    super(message);
    this.source = source;
  }

  public SearchException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
