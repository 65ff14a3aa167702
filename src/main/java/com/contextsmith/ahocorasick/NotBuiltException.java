package com.contextsmith.ahocorasick;

/**
 * Thrown when a search is started on an automaton that was never compiled.
 */
public class NotBuiltException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public NotBuiltException(String message) {
    super(message);
  }
}
