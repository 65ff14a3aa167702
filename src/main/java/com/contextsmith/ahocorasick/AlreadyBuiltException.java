package com.contextsmith.ahocorasick;

/**
 * Thrown when patterns are inserted into, or compilation is requested on, an
 * automaton that has already been compiled.
 */
public class AlreadyBuiltException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public AlreadyBuiltException(String message) {
    super(message);
  }
}
