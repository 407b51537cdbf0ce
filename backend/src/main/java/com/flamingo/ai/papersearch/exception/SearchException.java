package com.flamingo.ai.papersearch.exception;

/** The chunk store failed to serve a search or a write. Mapped to HTTP 503. */
public class SearchException extends RuntimeException {

  private static final String USER_MESSAGE = "Search is temporarily unavailable. Please try again.";

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
