package com.contextsmith.daac;

/** The pattern set is empty or holds an empty, negative or too long pattern. */
public class InvalidInputException extends ConstructionException {
  private static final long serialVersionUID = -6329874166402553247L;

  public InvalidInputException(String message) {
    super(message);
  }
}
