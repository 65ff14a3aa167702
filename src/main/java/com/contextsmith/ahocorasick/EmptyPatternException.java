package com.contextsmith.ahocorasick;

/**
 * Thrown when a pattern without any symbol is inserted.
 */
public class EmptyPatternException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public EmptyPatternException(String message) {
    super(message);
  }
}
