package io.github.fiserro.homeheat.history;

/** A history query could not be answered. */
public class HistoryQueryException extends Exception {

  public HistoryQueryException(String message) {
    super(message);
  }

  public HistoryQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
