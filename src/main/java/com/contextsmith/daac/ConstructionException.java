package com.contextsmith.daac;

/**
 * Thrown when an automaton cannot be built. No automaton is returned when
 * this is thrown.
 */
public class ConstructionException extends Exception {
  private static final long serialVersionUID = 4021968307614385510L;

  public ConstructionException(String message) {
    super(message);
  }
}
